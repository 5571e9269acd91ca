package com.alterante.speedtest.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Incremental HTTP/1.1 response parser for one persistent connection.
 *
 * Socket reads are appended to an internal arena buffer; {@link #process()}
 * advances the state machine over whatever is buffered and returns at most one
 * completed response. Bytes past the end of that response stay buffered for the
 * next request on the same connection.
 *
 * <pre>
 * IDLE --expectResponse--&gt; HEADERS
 * HEADERS    --1xx--&gt;                 HEADERS
 *            --HEAD/204/304--&gt;        complete
 *            --chunked--&gt;             CHUNK_SIZE
 *            --Content-Length--&gt;      FIXED_BODY
 *            --neither--&gt;             UNTIL_CLOSE
 * CHUNK_SIZE --0--&gt;                   TRAILERS --empty line--&gt; complete
 * CHUNK_SIZE --n--&gt;                   CHUNK_DATA --n bytes--&gt; CHUNK_END --CRLF--&gt; CHUNK_SIZE
 * FIXED_BODY --remaining == 0--&gt;      complete
 * UNTIL_CLOSE --peer close--&gt;         complete
 * complete --&gt; IDLE
 * </pre>
 *
 * Not thread-safe: owned by a single connection.
 */
public class HttpResponseParser {

    public static final int MAX_HEADER_BYTES = 64 * 1024;
    private static final int MAX_CHUNK_LINE = 1024;
    private static final int INITIAL_CAPACITY = 16 * 1024;
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] CRLF_CRLF = {'\r', '\n', '\r', '\n'};

    private enum State { IDLE, HEADERS, FIXED_BODY, CHUNK_SIZE, CHUNK_DATA, CHUNK_END, TRAILERS, UNTIL_CLOSE }

    private byte[] buf = new byte[INITIAL_CAPACITY];
    private int start;
    private int end;
    private int headerScanned;

    private State state = State.IDLE;
    private boolean headRequest;
    private int captureLimit;

    private int status;
    private Map<String, String> headers;
    private long remaining;
    private long bodyBytes;
    private ByteArrayOutputStream capture;
    private ParsedResponse completed;

    /**
     * Arm the parser for the response to a request that is about to be sent.
     *
     * @param headRequest  true for HEAD, whose response never has a body
     * @param captureLimit how many body bytes to keep in {@link ParsedResponse#body()}, 0 for none
     */
    public void expectResponse(boolean headRequest, int captureLimit) {
        if (state != State.IDLE) {
            throw new IllegalStateException("A response is already pending");
        }
        this.headRequest = headRequest;
        this.captureLimit = captureLimit;
        this.status = 0;
        this.headers = new LinkedHashMap<>();
        this.remaining = 0;
        this.bodyBytes = 0;
        this.capture = captureLimit > 0 ? new ByteArrayOutputStream(Math.min(captureLimit, 64 * 1024)) : null;
        this.headerScanned = 0;
        this.state = State.HEADERS;
    }

    /** Append bytes read from the socket. */
    public void append(byte[] data, int off, int len) {
        ensureCapacity(len);
        System.arraycopy(data, off, buf, end, len);
        end += len;
    }

    /** Append then {@link #process()}. */
    public ParsedResponse feed(byte[] data, int off, int len) throws ProtocolException {
        append(data, off, len);
        return process();
    }

    /**
     * Advance over buffered bytes.
     *
     * @return the completed response, or null if more input is needed or none is expected
     */
    public ParsedResponse process() throws ProtocolException {
        while (state != State.IDLE) {
            boolean progressed;
            switch (state) {
                case HEADERS -> progressed = readHeaders();
                case FIXED_BODY -> progressed = readFixedBody();
                case CHUNK_SIZE -> progressed = readChunkSize();
                case CHUNK_DATA -> progressed = readChunkData();
                case CHUNK_END -> progressed = readChunkEnd();
                case TRAILERS -> progressed = readTrailers();
                case UNTIL_CLOSE -> {
                    consumeBody(end - start);
                    progressed = false;
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
            if (completed != null) {
                ParsedResponse r = completed;
                completed = null;
                return r;
            }
            if (!progressed) return null;
        }
        return null;
    }

    /**
     * The peer closed the connection.
     *
     * @return the completed response if its body was delimited by close, else null
     */
    public ParsedResponse onClose() {
        ParsedResponse result = null;
        if (state == State.UNTIL_CLOSE) {
            consumeBody(end - start);
            complete();
            result = completed;
            completed = null;
        }
        state = State.IDLE;
        start = 0;
        end = 0;
        return result;
    }

    public boolean isAwaitingResponse() {
        return state != State.IDLE;
    }

    /** Bytes buffered but not yet consumed (leftover of the next response). */
    public int buffered() {
        return end - start;
    }

    // --- States ---

    private boolean readHeaders() throws ProtocolException {
        int from = start + Math.max(0, headerScanned - 3);
        int idx = indexOf(CRLF_CRLF, from);
        if (idx < 0) {
            if (end - start > MAX_HEADER_BYTES) {
                throw new ProtocolException("Header block exceeds " + MAX_HEADER_BYTES + " bytes");
            }
            headerScanned = end - start;
            return false;
        }
        String block = new String(buf, start, idx - start, StandardCharsets.ISO_8859_1);
        consume(idx + CRLF_CRLF.length - start);
        headerScanned = 0;
        parseHeaderBlock(block);

        if (status < 200) {
            // Interim response (100 Continue etc.): the real one follows.
            headers = new LinkedHashMap<>();
            return true;
        }
        if (headRequest || status == 204 || status == 304) {
            complete();
            return true;
        }
        String te = headers.get("transfer-encoding");
        if (te != null && te.toLowerCase(Locale.ROOT).contains("chunked")) {
            state = State.CHUNK_SIZE;
            return true;
        }
        String cl = headers.get("content-length");
        if (cl != null) {
            remaining = parseContentLength(cl);
            if (remaining == 0) {
                complete();
            } else {
                state = State.FIXED_BODY;
            }
            return true;
        }
        state = State.UNTIL_CLOSE;
        return true;
    }

    private boolean readFixedBody() {
        int n = (int) Math.min(end - start, remaining);
        if (n == 0) return false;
        consumeBody(n);
        remaining -= n;
        if (remaining == 0) complete();
        return true;
    }

    private boolean readChunkSize() throws ProtocolException {
        int idx = indexOf(CRLF, start);
        if (idx < 0) {
            if (end - start > MAX_CHUNK_LINE) {
                throw new ProtocolException("Chunk size line too long");
            }
            return false;
        }
        String line = new String(buf, start, idx - start, StandardCharsets.ISO_8859_1);
        consume(idx + CRLF.length - start);
        int semi = line.indexOf(';');
        if (semi >= 0) line = line.substring(0, semi);
        long size;
        try {
            size = Long.parseLong(line.trim(), 16);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid chunk size: " + line, e);
        }
        if (size < 0) throw new ProtocolException("Negative chunk size: " + line);
        if (size == 0) {
            state = State.TRAILERS;
        } else {
            remaining = size;
            state = State.CHUNK_DATA;
        }
        return true;
    }

    private boolean readChunkData() {
        int n = (int) Math.min(end - start, remaining);
        if (n == 0) return false;
        consumeBody(n);
        remaining -= n;
        if (remaining == 0) state = State.CHUNK_END;
        return true;
    }

    private boolean readChunkEnd() throws ProtocolException {
        if (end - start < 2) return false;
        if (buf[start] != '\r' || buf[start + 1] != '\n') {
            throw new ProtocolException("Missing CRLF after chunk data");
        }
        consume(2);
        state = State.CHUNK_SIZE;
        return true;
    }

    private boolean readTrailers() throws ProtocolException {
        int idx = indexOf(CRLF, start);
        if (idx < 0) {
            if (end - start > MAX_HEADER_BYTES) {
                throw new ProtocolException("Trailer section too long");
            }
            return false;
        }
        boolean emptyLine = idx == start;
        consume(idx + CRLF.length - start);
        if (emptyLine) complete();
        return true;
    }

    // --- Helpers ---

    private void parseHeaderBlock(String block) throws ProtocolException {
        String[] lines = block.split("\r\n");
        String statusLine = lines[0];
        if (!statusLine.startsWith("HTTP/1.")) {
            throw new ProtocolException("Malformed status line: " + abbreviate(statusLine));
        }
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2) {
            throw new ProtocolException("Malformed status line: " + abbreviate(statusLine));
        }
        try {
            status = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Malformed status code: " + abbreviate(statusLine), e);
        }
        if (status < 100 || status > 999) {
            throw new ProtocolException("Status code out of range: " + status);
        }
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new ProtocolException("Malformed header line: " + abbreviate(line));
            }
            String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            headers.merge(name, value, (a, b) -> a + ", " + b);
        }
    }

    private static long parseContentLength(String value) throws ProtocolException {
        try {
            long n = Long.parseLong(value.trim());
            if (n < 0) throw new ProtocolException("Negative Content-Length: " + value);
            return n;
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + value, e);
        }
    }

    private void consumeBody(int n) {
        if (n <= 0) return;
        if (capture != null && capture.size() < captureLimit) {
            int keep = Math.min(n, captureLimit - capture.size());
            capture.write(buf, start, keep);
        }
        bodyBytes += n;
        consume(n);
    }

    private void complete() {
        byte[] body = capture != null ? capture.toByteArray() : new byte[0];
        completed = new ParsedResponse(status, bodyBytes, Map.copyOf(headers), body);
        state = State.IDLE;
    }

    private void consume(int n) {
        start += n;
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    private void ensureCapacity(int len) {
        if (end + len <= buf.length) return;
        int live = end - start;
        if (start > 0) {
            System.arraycopy(buf, start, buf, 0, live);
            start = 0;
            end = live;
        }
        if (end + len > buf.length) {
            int cap = buf.length;
            while (cap < end + len) cap *= 2;
            buf = Arrays.copyOf(buf, cap);
        }
    }

    private int indexOf(byte[] pattern, int from) {
        int last = end - pattern.length;
        outer:
        for (int i = from; i <= last; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (buf[i + j] != pattern[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }
}
