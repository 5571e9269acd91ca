package com.alterante.speedtest.net;

import com.alterante.speedtest.protocol.HttpRequest;
import com.alterante.speedtest.protocol.HttpResponseParser;
import com.alterante.speedtest.protocol.ParsedResponse;
import com.alterante.speedtest.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongConsumer;

/**
 * Persistent HTTP/1.1 connection over one already-connected socket.
 *
 * Requests are issued one at a time (no pipelining) and the same connection is
 * reused for as long as the server keeps it open. Every byte read from the
 * socket is reported to the inbound listener as soon as it is read, so a
 * download is counted while it streams rather than when a response completes.
 *
 * A socket error or peer close completes the pending request with
 * {@link ParsedResponse#closed()} and closes the connection. A framing error
 * closes the connection and surfaces as {@link ProtocolException}.
 */
public class HttpConnection implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(HttpConnection.class);

    private static final int READ_BUFFER_SIZE = 64 * 1024;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final LongConsumer inbound;
    private final Runnable onClose;
    private final HttpResponseParser parser = new HttpResponseParser();
    private final byte[] readBuffer = new byte[READ_BUFFER_SIZE];
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private long requests;

    /**
     * @param socket  connected socket, plain or TLS
     * @param inbound receives byte counts as they are read, may be null
     * @param onClose run once when the connection closes, may be null
     */
    public HttpConnection(Socket socket, LongConsumer inbound, Runnable onClose) throws IOException {
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
        this.inbound = inbound != null ? inbound : n -> { };
        this.onClose = onClose != null ? onClose : () -> { };
    }

    public ParsedResponse sendRequest(HttpRequest request) throws ProtocolException {
        return sendRequest(request.encode(), request.isHead(), 0);
    }

    /** Send a request and keep up to {@code captureLimit} body bytes in the response. */
    public ParsedResponse sendRequest(HttpRequest request, int captureLimit) throws ProtocolException {
        return sendRequest(request.encode(), request.isHead(), captureLimit);
    }

    /**
     * Write a complete request and read its response.
     *
     * @param headRequest true if the request is HEAD (response has no body)
     */
    public ParsedResponse sendRequest(byte[] requestBytes, boolean headRequest, int captureLimit)
            throws ProtocolException {
        beginRequest();
        try {
            if (closed.get()) return ParsedResponse.closed();
            parser.expectResponse(headRequest, captureLimit);
            out.write(requestBytes);
            out.flush();
            return awaitResponse();
        } catch (IOException e) {
            return failed(e);
        } finally {
            inFlight.set(false);
        }
    }

    /**
     * Write a request header, then the body in {@code sliceSize} slices, flushing
     * each slice and reporting it to {@code onSliceSent} only once the flush returns.
     */
    public ParsedResponse sendRequestChunked(byte[] header, byte[] body, int sliceSize, LongConsumer onSliceSent)
            throws ProtocolException {
        if (sliceSize <= 0) throw new IllegalArgumentException("sliceSize must be positive");
        beginRequest();
        try {
            if (closed.get()) return ParsedResponse.closed();
            parser.expectResponse(false, 0);
            out.write(header);
            out.flush();
            for (int off = 0; off < body.length; off += sliceSize) {
                int len = Math.min(sliceSize, body.length - off);
                out.write(body, off, len);
                out.flush();
                onSliceSent.accept(len);
            }
            return awaitResponse();
        } catch (IOException e) {
            return failed(e);
        } finally {
            inFlight.set(false);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Address of the connected peer, or null. */
    public String remoteIp() {
        return socket.getInetAddress() != null ? socket.getInetAddress().getHostAddress() : null;
    }

    /** Requests completed on this connection. */
    public long requestCount() {
        return requests;
    }

    /** Hard close: releases the transport first, then the socket. Idempotent. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        onClose.run();
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", socket.getRemoteSocketAddress(), e.getMessage());
        }
    }

    // --- Internals ---

    private void beginRequest() {
        if (!inFlight.compareAndSet(false, true)) {
            throw new IllegalStateException("A request is already in flight on this connection");
        }
    }

    private ParsedResponse awaitResponse() throws IOException, ProtocolException {
        try {
            ParsedResponse response = parser.process();
            while (response == null) {
                int n = in.read(readBuffer);
                if (n < 0) {
                    response = parser.onClose();
                    close();
                    return response != null ? countCompleted(response) : ParsedResponse.closed();
                }
                inbound.accept(n);
                response = parser.feed(readBuffer, 0, n);
            }
            return countCompleted(response);
        } catch (ProtocolException e) {
            close();
            throw e;
        }
    }

    private ParsedResponse countCompleted(ParsedResponse response) {
        requests++;
        String connection = response.header("connection");
        if (connection != null && connection.equalsIgnoreCase("close")) {
            close();
        }
        return response;
    }

    private ParsedResponse failed(IOException e) {
        if (!closed.get()) {
            log.debug("Connection to {} failed: {}", socket.getRemoteSocketAddress(), e.toString());
        }
        close();
        return ParsedResponse.closed();
    }
}
