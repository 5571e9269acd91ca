package com.alterante.speedtest.net;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.protocol.HttpRequest;
import org.bouncycastle.jsse.provider.BouncyCastleJsseProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.function.LongConsumer;

/**
 * Opens lifecycle-tracked TCP connections, optionally wrapped in TLS.
 *
 * The plain socket is registered with the lifecycle before {@code connect()} so
 * that a forced teardown aborts a stalled connect or handshake. TLS is layered
 * on top using the BouncyCastle JSSE provider.
 */
public class SocketConnector {

    private static final Logger log = LoggerFactory.getLogger(SocketConnector.class);

    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_READ_TIMEOUT_MS = 20_000;
    private static final int BUFFER_SIZE = 256 * 1024;

    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private volatile SSLSocketFactory tlsFactory;

    public SocketConnector() {
        this(DEFAULT_CONNECT_TIMEOUT_MS, DEFAULT_READ_TIMEOUT_MS);
    }

    public SocketConnector(int connectTimeoutMs, int readTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Connect to the URI's host and wrap the socket in an {@link HttpConnection}.
     * Closing the connection releases the socket from the lifecycle.
     *
     * @param inbound receives every byte count read from the wire, may be null
     */
    public HttpConnection open(ResourceLifecycle lifecycle, URI uri, LongConsumer inbound) throws IOException {
        String host = uri.getHost();
        int port = HttpRequest.port(uri);
        Socket raw = new Socket();
        lifecycle.registerSocket(raw);
        try {
            raw.setTcpNoDelay(true);
            raw.setReceiveBufferSize(BUFFER_SIZE);
            raw.setSendBufferSize(BUFFER_SIZE);
            raw.setSoTimeout(readTimeoutMs);
            raw.connect(new InetSocketAddress(host, port), connectTimeoutMs);

            Socket socket = raw;
            if (HttpRequest.isTls(uri)) {
                SSLSocket ssl = (SSLSocket) tlsFactory().createSocket(raw, host, port, true);
                ssl.setUseClientMode(true);
                ssl.startHandshake();
                log.debug("TLS {} established with {}:{}", ssl.getSession().getProtocol(), host, port);
                socket = ssl;
            }
            return new HttpConnection(socket, inbound, () -> lifecycle.closeSocket(raw));
        } catch (IOException e) {
            lifecycle.closeSocket(raw);
            throw e;
        }
    }

    private SSLSocketFactory tlsFactory() throws IOException {
        SSLSocketFactory f = tlsFactory;
        if (f == null) {
            synchronized (this) {
                f = tlsFactory;
                if (f == null) {
                    f = createTlsFactory();
                    tlsFactory = f;
                }
            }
        }
        return f;
    }

    private static SSLSocketFactory createTlsFactory() throws IOException {
        try {
            SSLContext context = SSLContext.getInstance("TLS", new BouncyCastleJsseProvider());
            context.init(null, null, new SecureRandom());
            return context.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IOException("TLS unavailable: " + e.getMessage(), e);
        }
    }
}
