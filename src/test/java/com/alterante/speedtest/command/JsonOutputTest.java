package com.alterante.speedtest.command;

import com.alterante.speedtest.engine.MeasurementResult;
import com.alterante.speedtest.engine.RunState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonOutputTest {

    @Test
    void statusUsesShortStateNames() {
        assertEquals("{\"event\":\"status\",\"state\":\"latency\"}", JsonOutput.statusLine(RunState.MEASURING_LATENCY));
        assertEquals("{\"event\":\"status\",\"state\":\"downloading\"}", JsonOutput.statusLine(RunState.DOWNLOADING));
    }

    @Test
    void progressRendersNullLatency() {
        MeasurementResult r = new MeasurementResult(93.456, 0, null, null, false, null,
                "Downloading", RunState.DOWNLOADING, Map.of());
        assertEquals("{\"event\":\"progress\",\"state\":\"downloading\",\"download_mbps\":93.46,\"upload_mbps\":0.00,"
                + "\"ping_ms\":null,\"jitter_ms\":null,\"status\":\"Downloading\"}", JsonOutput.progressLine(r));
    }

    @Test
    void completeRendersMetadataValues() {
        MeasurementResult r = new MeasurementResult(100, 20, 12.34, 1.5, true, null, "Complete", RunState.DONE,
                Map.of("urls", List.of("https://a/x", "https://b/\"y\"")));
        String line = JsonOutput.completeLine(r);
        assertTrue(line.startsWith("{\"event\":\"complete\",\"state\":\"done\",\"download_mbps\":100.00,"));
        assertTrue(line.contains("\"ping_ms\":12.34,\"jitter_ms\":1.50"));
        assertTrue(line.endsWith("\"metadata\":{\"urls\":[\"https://a/x\",\"https://b/\\\"y\\\"\"]}}"));
    }

    @Test
    void completeRendersNumbersUnquoted() {
        MeasurementResult r = new MeasurementResult(1, 1, null, null, true, null, "Complete", RunState.DONE,
                Map.of("streams", 4));
        assertTrue(JsonOutput.completeLine(r).endsWith("\"metadata\":{\"streams\":4}}"));
    }

    @Test
    void errorEscapesMessage() {
        assertEquals("{\"event\":\"error\",\"message\":\"bad \\\"target\\\"\\nline\"}",
                JsonOutput.errorLine("bad \"target\"\nline"));
    }
}
