package io.eventrelay.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.eventrelay.error.ErrorKind;
import io.eventrelay.error.ValidationException;
import io.eventrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Request/response adapter: {@code POST /events} takes one request frame and returns the
 * reply frame. There is no push channel, so subscriptions are refused.
 */
public final class HttpEventAdapter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HttpEventAdapter.class);
    private static final int MAX_BODY_BYTES = 16 * 1024 * 1024;

    private final HttpServer server;

    public HttpEventAdapter(String host, int port, RequestHandler handler, Supplier<Object> health,
                            ExecutorService executor) throws IOException {
        String bindHost = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.server = HttpServer.create(new InetSocketAddress(bindHost, port), 0);
        server.createContext("/events", exchange -> {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, WireProtocol.error(null, null, ErrorKind.VALIDATION, "use POST"), 405);
                    return;
                }
                WireRequest request = WireProtocol.parse(readBody(exchange));
                ObjectNode response = handler.handle(request, null);
                writeJson(exchange, response, WireProtocol.isError(response) ? statusFor(response) : 200);
            } catch (ValidationException e) {
                writeJson(exchange, WireProtocol.error(null, null, e.kind(), e.getMessage()), 400);
            } catch (RuntimeException e) {
                log.warn("HTTP request failed", e);
                writeJson(exchange, WireProtocol.error(null, null, ErrorKind.INTERNAL, e.getMessage()), 500);
            }
        });
        server.createContext("/health", exchange -> writeJson(exchange, health.get(), 200));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("HTTP adapter listening on http://{}:{}/events",
                server.getAddress().getHostString(), server.getAddress().getPort());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private static int statusFor(ObjectNode response) {
        String type = response.path("error").path("type").asText("");
        if (ErrorKind.NOT_FOUND.wireName().equals(type)) {
            return 404;
        }
        if (ErrorKind.QUEUE_FULL.wireName().equals(type)) {
            return 429;
        }
        if (ErrorKind.INTERNAL.wireName().equals(type)) {
            return 500;
        }
        return 400;
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readNBytes(MAX_BODY_BYTES + 1);
            if (bytes.length > MAX_BODY_BYTES) {
                throw new ValidationException("request body exceeds " + MAX_BODY_BYTES + " bytes");
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
