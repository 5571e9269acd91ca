package com.alterante.speedtest.command;

import com.alterante.speedtest.engine.EngineOptions;
import com.alterante.speedtest.engine.EngineRegistry;
import com.alterante.speedtest.engine.MeasurementEngine;
import com.alterante.speedtest.engine.MeasurementResult;
import com.alterante.speedtest.engine.Orchestrator;
import com.alterante.speedtest.engine.RunSettings;
import com.alterante.speedtest.engine.RunState;
import picocli.CommandLine;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@CommandLine.Command(
        name = "run",
        description = "Measure download and upload throughput",
        mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    // No static logger here: --verbose must set the log level before SLF4J initializes.

    @CommandLine.Option(names = {"--engine", "-e"}, description = "Engine to use (see 'engines')", defaultValue = "range")
    private String engine;

    @CommandLine.Option(names = {"--url", "-u"}, description = "Download target or discovery candidate (repeatable)")
    private List<URI> urls = new ArrayList<>();

    @CommandLine.Option(names = {"--upload-url"}, description = "Primary upload endpoint (repeatable)")
    private List<URI> uploadUrls = new ArrayList<>();

    @CommandLine.Option(names = {"--catalog-url"}, description = "JSON target catalog for the catalog engine")
    private URI catalogUrl;

    @CommandLine.Option(names = {"--shared-upload-url"}, description = "Last-resort upload endpoint used by every engine")
    private URI sharedUploadUrl;

    @CommandLine.Option(names = {"--duration", "-d"}, description = "Seconds per phase (default: ${DEFAULT-VALUE})", defaultValue = "15")
    private int durationSeconds;

    @CommandLine.Option(names = {"--tick-ms"}, description = "Live update interval in ms (default: ${DEFAULT-VALUE})", defaultValue = "200")
    private long tickMs;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @CommandLine.Option(names = {"--verbose", "-v"}, description = "Debug logging")
    private boolean verbose;

    @Override
    public Integer call() throws Exception {
        try {
            return doRun();
        } catch (Exception e) {
            if (json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private Integer doRun() throws InterruptedException {
        if (verbose) {
            System.setProperty("org.slf4j.simpleLogger.log.com.alterante.speedtest", "debug");
        }

        Optional<EngineRegistry.Entry> entry = EngineRegistry.byName(engine);
        if (entry.isEmpty()) {
            String msg = "unknown engine: " + engine + " (available: " + String.join(", ", EngineRegistry.names()) + ")";
            if (json) { JsonOutput.error(msg); return 1; }
            System.err.println("Error: " + msg);
            return 1;
        }

        RunSettings settings = RunSettings.defaults()
                .withPhaseDuration(Duration.ofSeconds(durationSeconds))
                .withTickInterval(Duration.ofMillis(tickMs));
        MeasurementEngine measurementEngine = entry.get().create(new EngineOptions(urls, uploadUrls, catalogUrl, sharedUploadUrl));
        CountDownLatch finished = new CountDownLatch(1);

        try (Orchestrator orchestrator = new Orchestrator(settings)) {
            if (json) {
                orchestrator.setStateListener(JsonOutput::status);
            }

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (finished.getCount() == 0) return;
                if (!json) System.out.println("\nCancelling...");
                orchestrator.cancel();
                try {
                    finished.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown"));

            if (!json) System.out.println("Engine: " + measurementEngine.name());
            MeasurementResult result = orchestrator.run(measurementEngine, r -> {
                if (r.isTerminal()) return;
                if (json) {
                    JsonOutput.progress(r);
                } else {
                    printLive(r);
                }
            });

            if (json) {
                if (result.error() != null) {
                    JsonOutput.error(result.error());
                } else {
                    JsonOutput.complete(result);
                }
            } else {
                printFinal(result);
            }
            finished.countDown();
            return result.state() == RunState.ERROR ? 1 : 0;
        }
    }

    private void printLive(MeasurementResult r) {
        StringBuilder line = new StringBuilder("\r");
        line.append(String.format("%-28s DL %8.2f Mbps  UL %8.2f Mbps", r.status(), r.downloadMbps(), r.uploadMbps()));
        if (r.pingMs() != null) {
            line.append(String.format("  ping %.1f ms", r.pingMs()));
        }
        System.out.print(line);
        System.out.flush();
    }

    private void printFinal(MeasurementResult r) {
        System.out.println();
        if (r.error() != null) {
            System.err.println("Error: " + r.error());
            return;
        }
        System.out.println(r.state() == RunState.CANCELLED ? "Measurement cancelled." : "Measurement complete!");
        System.out.printf("  Download: %.2f Mbps%n", r.downloadMbps());
        System.out.printf("  Upload:   %.2f Mbps%n", r.uploadMbps());
        if (r.pingMs() != null) {
            System.out.printf("  Ping:     %.1f ms (jitter %.1f ms)%n", r.pingMs(), r.jitterMs());
        }
        for (Map.Entry<String, Object> e : r.metadata().entrySet()) {
            System.out.println("  " + e.getKey() + ": " + e.getValue());
        }
    }
}
