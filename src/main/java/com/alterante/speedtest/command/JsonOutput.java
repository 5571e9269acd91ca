package com.alterante.speedtest.command;

import com.alterante.speedtest.engine.MeasurementResult;
import com.alterante.speedtest.engine.RunState;

import java.util.Collection;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Emits newline-delimited JSON events to stdout for machine-readable output.
 * Used by RunCommand when --json flag is set.
 */
final class JsonOutput {

    private JsonOutput() {}

    static void status(RunState state) {
        emit(statusLine(state));
    }

    static void progress(MeasurementResult r) {
        emit(progressLine(r));
    }

    static void complete(MeasurementResult r) {
        emit(completeLine(r));
    }

    static void error(String message) {
        emit(errorLine(message));
    }

    static String statusLine(RunState state) {
        return format("{\"event\":\"status\",\"state\":\"%s\"}", stateName(state));
    }

    static String progressLine(MeasurementResult r) {
        return format("{\"event\":\"progress\",\"state\":\"%s\",\"download_mbps\":%.2f,\"upload_mbps\":%.2f,"
                        + "\"ping_ms\":%s,\"jitter_ms\":%s,\"status\":\"%s\"}",
                stateName(r.state()), r.downloadMbps(), r.uploadMbps(),
                number(r.pingMs()), number(r.jitterMs()), escapeJson(r.status()));
    }

    static String completeLine(MeasurementResult r) {
        return format("{\"event\":\"complete\",\"state\":\"%s\",\"download_mbps\":%.2f,\"upload_mbps\":%.2f,"
                        + "\"ping_ms\":%s,\"jitter_ms\":%s,\"metadata\":%s}",
                stateName(r.state()), r.downloadMbps(), r.uploadMbps(),
                number(r.pingMs()), number(r.jitterMs()), object(r.metadata()));
    }

    static String errorLine(String message) {
        return format("{\"event\":\"error\",\"message\":\"%s\"}", escapeJson(message));
    }

    private static String stateName(RunState state) {
        return switch (state) {
            case MEASURING_LATENCY -> "latency";
            default -> state.name().toLowerCase(Locale.ROOT);
        };
    }

    private static String number(Double d) {
        return d == null ? "null" : String.format(Locale.ROOT, "%.2f", d);
    }

    private static String object(Map<String, Object> map) {
        StringBuilder sb = new StringBuilder("{");
        Iterator<Map.Entry<String, Object>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Object> e = it.next();
            sb.append('"').append(escapeJson(e.getKey())).append("\":").append(value(e.getValue()));
            if (it.hasNext()) sb.append(',');
        }
        return sb.append('}').toString();
    }

    private static String value(Object v) {
        if (v == null) return "null";
        if (v instanceof Number || v instanceof Boolean) return v.toString();
        if (v instanceof Collection) {
            StringBuilder sb = new StringBuilder("[");
            Iterator<?> it = ((Collection<?>) v).iterator();
            while (it.hasNext()) {
                sb.append(value(it.next()));
                if (it.hasNext()) sb.append(',');
            }
            return sb.append(']').toString();
        }
        return "\"" + escapeJson(v.toString()) + "\"";
    }

    private static String format(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }

    private static void emit(String line) {
        System.out.println(line);
        System.out.flush();
    }

    private static String escapeJson(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
