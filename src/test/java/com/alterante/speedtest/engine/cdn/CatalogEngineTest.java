package com.alterante.speedtest.engine.cdn;

import com.alterante.speedtest.engine.EngineOptions;
import com.alterante.speedtest.engine.MeasurementResult;
import com.alterante.speedtest.engine.Orchestrator;
import com.alterante.speedtest.engine.RunSettings;
import com.alterante.speedtest.engine.RunState;
import com.alterante.speedtest.net.SocketConnector;
import com.alterante.speedtest.net.StubHttpServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CatalogEngineTest {

    private static final RunSettings SHORT = new RunSettings(Duration.ofMillis(700), Duration.ofMillis(100),
            Duration.ZERO, Duration.ZERO);

    private final CatalogEngine engine = new CatalogEngine(EngineOptions.defaults());

    @Test
    void parsesTargetUrls() throws Exception {
        String json = "{\"client\":{\"ip\":\"198.51.100.7\"},\"targets\":["
                + "{\"name\":\"a\",\"url\":\"https://a.example/speedtest?c=1\",\"location\":{\"city\":\"X\"}},"
                + "{\"name\":\"empty\",\"url\":\"\"},"
                + "{\"name\":\"missing\"},"
                + "{\"name\":\"b\",\"url\":\"https://b.example/speedtest?c=2\"}]}";
        assertEquals(List.of("https://a.example/speedtest?c=1", "https://b.example/speedtest?c=2"),
                engine.parseTargets(json));
        assertTrue(engine.parseTargets("{}").isEmpty());
    }

    @Test
    void malformedCatalogThrows() {
        assertThrows(IOException.class, () -> engine.parseTargets("{\"targets\": [oops"));
    }

    @Test
    void uploadUriKeepsHostAndQuery() {
        assertEquals(URI.create("https://ipv4-c001.example.net/speedtest/upload?c=us&e=123"),
                CatalogEngine.uploadUri(URI.create("https://ipv4-c001.example.net/speedtest?c=us&e=123")));
        assertEquals(URI.create("http://127.0.0.1:8080/speedtest/upload"),
                CatalogEngine.uploadUri(URI.create("http://127.0.0.1:8080/files/x.bin")));
    }

    @Test
    void fullRunSpreadsStreamsOverCatalogTargets() throws Exception {
        byte[] content = new byte[512 * 1024];
        StubHttpServer[] holder = new StubHttpServer[1];
        try (StubHttpServer server = new StubHttpServer(r -> {
            if (r.target().equals("/catalog")) {
                String json = "{\"targets\":[{\"url\":\"" + holder[0].uri("/t1") + "\"},{\"url\":\""
                        + holder[0].uri("/t2") + "\"}]}";
                return StubHttpServer.Reply.of(200, json).withHeader("Content-Type", "application/json");
            }
            return StubHttpServer.staticReply(r, content);
        })) {
            holder[0] = server;
            EngineOptions options = new EngineOptions(List.of(), List.of(), server.uri("/catalog"));
            CatalogEngine catalog = new CatalogEngine(options, new SocketConnector(2_000, 5_000));

            MeasurementResult result;
            try (Orchestrator orchestrator = new Orchestrator(SHORT)) {
                result = orchestrator.run(catalog, null);
            }

            assertEquals(RunState.DONE, result.state(), result.error());
            assertTrue(result.downloadMbps() > 0);
            assertTrue(result.uploadMbps() > 0);
            assertEquals(2, result.metadata().get("streams"));
            assertEquals(Set.of(server.uri("/t1").toString(), server.uri("/t2").toString()),
                    Set.copyOf((List<?>) result.metadata().get(CatalogEngine.KEY_URLS)));
            assertEquals(2, result.metadata().get(CatalogEngine.ANNOTATION_UPLOAD_STREAMS));
            assertEquals("catalog", result.metadata().get(TieredUploader.ANNOTATION));
            assertTrue(server.requests().stream().anyMatch(r -> r.target().equals("/t2")));
            assertTrue(server.requests().stream()
                    .anyMatch(r -> r.method().equals("POST") && r.target().equals(CatalogEngine.UPLOAD_PATH)));
        }
    }

    @Test
    void emptyCatalogIsAnError() throws Exception {
        try (StubHttpServer server = new StubHttpServer(r -> StubHttpServer.Reply.of(200, "{\"targets\":[]}"))) {
            CatalogEngine catalog = new CatalogEngine(new EngineOptions(List.of(), List.of(), server.uri("/catalog")),
                    new SocketConnector(2_000, 5_000));
            try (Orchestrator orchestrator = new Orchestrator(SHORT)) {
                MeasurementResult result = orchestrator.run(catalog, null);
                assertEquals(RunState.ERROR, result.state());
                assertEquals("catalog discovery failed.", result.error());
            }
        }
    }

    @Test
    void discoveryRanksTargetsByRoundTrip() throws Exception {
        int deadPort;
        try (ServerSocket s = new ServerSocket(0)) {
            deadPort = s.getLocalPort();
        }
        String dead = "http://127.0.0.1:" + deadPort + "/gone";
        StubHttpServer[] holder = new StubHttpServer[1];
        try (StubHttpServer server = new StubHttpServer(r -> {
            if (r.target().equals("/catalog")) {
                String json = "{\"targets\":[{\"url\":\"" + dead + "\"},{\"url\":\"" + holder[0].uri("/slow")
                        + "\"},{\"url\":\"" + holder[0].uri("/fast") + "\"}]}";
                return StubHttpServer.Reply.of(200, json);
            }
            if (r.target().equals("/slow")) sleep(200);
            return StubHttpServer.staticReply(r, new byte[4096]);
        });
             Orchestrator orchestrator = new Orchestrator(SHORT)) {
            holder[0] = server;
            CatalogEngine catalog = new CatalogEngine(new EngineOptions(List.of(), List.of(), server.uri("/catalog")),
                    new SocketConnector(2_000, 5_000));

            Map<String, Object> metadata = catalog.discover(orchestrator.lifecycle());

            assertNotNull(metadata);
            assertEquals(List.of(server.uri("/fast").toString(), server.uri("/slow").toString(), dead),
                    metadata.get(CatalogEngine.KEY_URLS));
            assertEquals(server.uri("/fast").toString(), metadata.get("url"));
            assertTrue(((Number) metadata.get(CatalogEngine.KEY_PROBE_RTT_MS)).longValue() < 200);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
