package com.loopfuzz.fuzzer.instrumentation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.loopfuzz.fuzzer.exec.TargetFaultException;
import com.loopfuzz.fuzzer.exec.TargetInfo;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

final class HttpTargetExecutorTest {

    private static HttpServer httpServer;
    private static TestHttpHandler httpHandler;
    private static URI targetUri;

    @BeforeAll
    static void setUp() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(0), 0);
        httpHandler = new TestHttpHandler();
        httpServer.createContext("/fuzz", httpHandler);
        httpServer.start();
        targetUri = URI.create("http://127.0.0.1:" + httpServer.getAddress().getPort() + "/fuzz");
    }

    @AfterAll
    static void tearDown() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
    }

    @AfterEach
    void resetHandler() {
        httpHandler.setDelegate(null);
    }

    private static HttpTargetExecutor<String> newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return new HttpTargetExecutor<>(
                targetUri,
                input -> input.getBytes(StandardCharsets.UTF_8),
                HttpClient.newHttpClient(),
                Duration.ofSeconds(2),
                () -> "req-" + counter.incrementAndGet());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] responseBody = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, responseBody.length);
        exchange.getResponseBody().write(responseBody);
        exchange.close();
    }

    @Test
    void postsTheEncodedInputTaggedWithTheRunId() throws Exception {
        var bodies = new LinkedBlockingQueue<String>();
        var requestIds = new LinkedBlockingQueue<String>();
        httpHandler.setDelegate(
                exchange -> {
                    requestIds.add(exchange.getRequestHeaders().getFirst(HttpTargetExecutor.HEADER_NAME));
                    bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                    respond(exchange, 200, "ok");
                });
        HttpTargetExecutor<String> executor = newExecutor();

        TargetInfo first = executor.initialize("{\"hello\":1}");
        TargetInfo second = executor.initialize("{}");
        executor.execute(first);
        executor.execute(second);

        assertEquals("req-1", first.runId());
        assertEquals("req-1", requestIds.poll());
        assertEquals("req-2", requestIds.poll());
        assertEquals("{\"hello\":1}", bodies.poll());
        assertEquals("{}", bodies.poll());
    }

    @Test
    void clientErrorsAreNotFaults() throws Exception {
        httpHandler.setDelegate(exchange -> respond(exchange, 404, "missing"));
        HttpTargetExecutor<String> executor = newExecutor();

        executor.execute(executor.initialize("x"));
    }

    @Test
    void serverErrorsRaiseTargetFault() {
        httpHandler.setDelegate(exchange -> respond(exchange, 500, "NullPointerException"));
        HttpTargetExecutor<String> executor = newExecutor();

        TargetFaultException fault =
                assertThrows(TargetFaultException.class, () -> executor.execute(executor.initialize("x")));
        assertEquals(500, fault.code());
        assertEquals("NullPointerException", fault.getMessage());
    }

    @Test
    void rejectsForeignHandles() {
        HttpTargetExecutor<String> executor = newExecutor();

        assertThrows(IllegalArgumentException.class, () -> executor.execute(() -> "foreign"));
    }

    private static final class TestHttpHandler implements HttpHandler {
        private volatile HttpHandler delegate;

        void setDelegate(HttpHandler delegate) {
            this.delegate = delegate;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            HttpHandler handler = delegate;
            if (handler != null) {
                handler.handle(exchange);
            } else {
                exchange.sendResponseHeaders(503, -1);
                exchange.close();
            }
        }
    }
}
