package com.alterante.speedtest.net;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.protocol.HttpRequest;
import com.alterante.speedtest.protocol.ParsedResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class HttpConnectionTest {

    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private ResourceLifecycle lifecycle;
    private final SocketConnector connector = new SocketConnector(2_000, 5_000);

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        lifecycle = new ResourceLifecycle(workers, scheduler);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    void reusesOneConnectionForSequentialRequests() throws Exception {
        byte[] content = new byte[50_000];
        try (StubHttpServer server = StubHttpServer.serving(content)) {
            URI uri = server.uri("/object.bin");
            AtomicLong inbound = new AtomicLong();
            HttpConnection conn = connector.open(lifecycle, uri, inbound::addAndGet);
            try {
                ParsedResponse full = conn.sendRequest(HttpRequest.get(uri));
                ParsedResponse part = conn.sendRequest(HttpRequest.get(uri).range(0, 999));

                assertEquals(200, full.statusCode());
                assertEquals(50_000, full.bodyBytes());
                assertEquals(206, part.statusCode());
                assertEquals(1000, part.bodyBytes());
                assertEquals(2, conn.requestCount());
                assertEquals(1, server.connectionCount());
                // Wire bytes include status lines and headers
                assertTrue(inbound.get() > 51_000);
                assertEquals(1, lifecycle.socketCount());
                assertEquals("127.0.0.1", conn.remoteIp());
            } finally {
                conn.close();
            }
            assertTrue(conn.isClosed());
            assertEquals(0, lifecycle.socketCount());
        }
    }

    @Test
    void slicedUploadReportsEachFlushedSlice() throws Exception {
        try (StubHttpServer server = StubHttpServer.serving(new byte[16])) {
            URI uri = server.uri("/upload");
            List<Long> slices = new CopyOnWriteArrayList<>();
            byte[] body = new byte[10_000];
            HttpConnection conn = connector.open(lifecycle, uri, null);
            try {
                ParsedResponse r = conn.sendRequestChunked(HttpRequest.post(uri, body.length).encode(), body, 4096,
                        slices::add);
                assertEquals(200, r.statusCode());
            } finally {
                conn.close();
            }
            assertEquals(List.of(4096L, 4096L, 1808L), slices);
            assertEquals(10_000, server.requests().get(0).bodyBytes());
        }
    }

    @Test
    void peerCloseYieldsClosedSentinel() throws Exception {
        try (StubHttpServer server = new StubHttpServer(r -> StubHttpServer.Reply.hangingUp())) {
            URI uri = server.uri("/hang");
            HttpConnection conn = connector.open(lifecycle, uri, null);
            ParsedResponse r = conn.sendRequest(HttpRequest.get(uri));
            assertTrue(r.isClosed());
            assertTrue(conn.isClosed());
            assertTrue(conn.sendRequest(HttpRequest.get(uri)).isClosed());
            assertEquals(0, lifecycle.socketCount());
        }
    }

    @Test
    void connectionCloseHeaderEndsConnection() throws Exception {
        try (StubHttpServer server = new StubHttpServer(r -> StubHttpServer.Reply.of(200, "bye").closing())) {
            URI uri = server.uri("/");
            HttpConnection conn = connector.open(lifecycle, uri, null);
            ParsedResponse r = conn.sendRequest(HttpRequest.get(uri));
            assertEquals(200, r.statusCode());
            assertTrue(conn.isClosed());
        }
    }

    @Test
    void refusedConnectReleasesSocket() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        URI uri = URI.create("http://127.0.0.1:" + port + "/");
        assertThrows(IOException.class, () -> connector.open(lifecycle, uri, null));
        assertEquals(0, lifecycle.socketCount());
    }

    @Test
    void cancelAbortsBlockedRead() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        StubHttpServer.Handler stall = r -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StubHttpServer.Reply.of(200, "late");
        };
        try (StubHttpServer server = new StubHttpServer(stall)) {
            URI uri = server.uri("/slow");
            HttpConnection conn = connector.open(lifecycle, uri, null);
            Future<ParsedResponse> pending = workers.submit(() -> conn.sendRequest(HttpRequest.get(uri)));
            Thread.sleep(200);

            lifecycle.cancel();

            ParsedResponse r = pending.get(2, TimeUnit.SECONDS);
            assertTrue(r.isClosed());
            assertTrue(conn.isClosed());
        } finally {
            release.countDown();
        }
    }
}
