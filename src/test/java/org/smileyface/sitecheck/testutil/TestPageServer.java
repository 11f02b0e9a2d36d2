package org.smileyface.sitecheck.testutil;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-process HTTP server serving canned pages by path. Unknown paths answer 404.
 * Every requested path is recorded.
 */
public class TestPageServer implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();

    public record Page(int status, String contentType, String body, String location, long delayMs) {
    }

    public TestPageServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", new PageHandler());
        server.setExecutor(executor);
        server.start();
    }

    public TestPageServer html(String path, String body) {
        pages.put(path, new Page(200, "text/html; charset=UTF-8", body, null, 0));
        return this;
    }

    /**
     * Serves {@code body} only after holding the request for {@code delayMs}.
     */
    public TestPageServer slow(String path, long delayMs, String body) {
        pages.put(path, new Page(200, "text/html; charset=UTF-8", body, null, delayMs));
        return this;
    }

    public TestPageServer page(String path, int status, String contentType, String body) {
        pages.put(path, new Page(status, contentType, body, null, 0));
        return this;
    }

    public TestPageServer redirect(String path, String location) {
        pages.put(path, new Page(301, "text/html", "", location, 0));
        return this;
    }

    public String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    public String url(String path) {
        return baseUrl() + path;
    }

    public List<String> requests() {
        return List.copyOf(requests);
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    public static String htmlPage(String title, String... inner) {
        String body = String.join("\n", inner);
        return "<!doctype html><html><head><title>" + title + "</title></head><body>" + body + "</body></html>";
    }

    private class PageHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            requests.add(path);
            Page page = pages.get(path);
            if (page == null) {
                send(exchange, 404, "text/plain", "Not found");
                return;
            }
            if (page.delayMs() > 0) {
                try {
                    Thread.sleep(page.delayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            if (page.location() != null) {
                exchange.getResponseHeaders().add("Location", page.location());
            }
            send(exchange, page.status(), page.contentType(), page.body());
        }

        private void send(HttpExchange ex, int code, String contentType, String body) throws IOException {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            if (contentType != null) {
                ex.getResponseHeaders().add("Content-Type", contentType);
            }
            ex.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
        }
    }
}
