package tech.andrefsramos.elearning_harvester.adapters.outbound.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.elearning_harvester.core.domain.RawResponse;
import tech.andrefsramos.elearning_harvester.core.domain.errors.FetchException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class JsoupHttpTransportTest {
    HttpServer server;
    String base;
    final Map<String, String> received = new ConcurrentHashMap<>();
    final AtomicInteger flakyCalls = new AtomicInteger();
    final AtomicInteger stallCalls = new AtomicInteger();
    final CountDownLatch releaseStalled = new CountDownLatch(1);
    ExecutorService handlers;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", ex -> {
            received.put("User-Agent", String.valueOf(ex.getRequestHeaders().getFirst("User-Agent")));
            received.put("Accept-Language", String.valueOf(ex.getRequestHeaders().getFirst("Accept-Language")));
            received.put("Cache-Control", String.valueOf(ex.getRequestHeaders().getFirst("Cache-Control")));
            respond(ex, 200, "<html><body><h1>Cursos</h1></body></html>");
        });
        server.createContext("/missing", ex -> respond(ex, 404, "<html><body>not found</body></html>"));
        server.createContext("/flaky", ex -> {
            if (flakyCalls.incrementAndGet() == 1) {
                respond(ex, 503, "busy");
            } else {
                respond(ex, 200, "<html><title>ok</title></html>");
            }
        });
        server.createContext("/stall", ex -> {
            stallCalls.incrementAndGet();
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, 10_000);
            OutputStream os = ex.getResponseBody();
            os.write("<html><body><h1>Cursos".getBytes(StandardCharsets.UTF_8));
            os.flush();
            try {
                releaseStalled.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ex.close();
        });
        handlers = Executors.newCachedThreadPool();
        server.setExecutor(handlers);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        releaseStalled.countDown();
        server.stop(0);
        handlers.shutdownNow();
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void sends_supplied_headers_and_returns_body() throws Exception {
        Map<String, String> headers = Map.of(
                "User-Agent", "HarvestTest/1.0",
                "Accept-Language", "en-US,en;q=0.9",
                "Cache-Control", "no-cache");

        RawResponse r = new JsoupHttpTransport().get(base + "/ok", headers, 5_000);

        assertEquals(200, r.statusCode());
        assertTrue(r.body().contains("Cursos"));
        assertEquals("HarvestTest/1.0", received.get("User-Agent"));
        assertEquals("en-US,en;q=0.9", received.get("Accept-Language"));
        assertEquals("no-cache", received.get("Cache-Control"));
    }

    @Test
    void error_status_is_returned_not_thrown() throws Exception {
        RawResponse r = new JsoupHttpTransport().get(base + "/missing", Map.of(), 5_000);

        assertEquals(404, r.statusCode());
        assertFalse(r.isSuccess());
    }

    @Test
    void fetch_retries_a_503_over_real_http() {
        List<Long> waits = new ArrayList<>();
        HttpFetch fetch = new HttpFetch(new JsoupHttpTransport(), "HarvestTest/1.0", null, 5_000, 3,
                BackoffPolicy.defaults(), waits::add);

        RawResponse r = fetch.fetch(base + "/flaky");

        assertEquals(200, r.statusCode());
        assertEquals(2, flakyCalls.get());
        assertEquals(List.of(1_000L), waits);
    }

    @Test
    void body_read_timeout_surfaces_as_io_exception() {
        assertThrows(IOException.class,
                () -> new JsoupHttpTransport().get(base + "/stall", Map.of(), 500));
    }

    @Test
    void fetch_retries_a_timeout_while_reading_the_body() {
        List<Long> waits = new ArrayList<>();
        HttpFetch fetch = new HttpFetch(new JsoupHttpTransport(), "HarvestTest/1.0", null, 500, 3,
                BackoffPolicy.defaults(), waits::add);

        FetchException ex = assertThrows(FetchException.class, () -> fetch.fetch(base + "/stall"));

        assertEquals(3, stallCalls.get());
        assertEquals(List.of(1_000L, 2_000L), waits);
        assertNull(ex.lastStatus());
        assertEquals(3, ex.attempts());
    }
}
