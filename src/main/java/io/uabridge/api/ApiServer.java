package io.uabridge.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.uabridge.hub.ClientInfo;
import io.uabridge.model.NodeAttributes;
import io.uabridge.model.TagExportRecord;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.runtime.SessionController;
import io.uabridge.runtime.TagCollection;
import io.uabridge.util.Jsons;
import io.uabridge.write.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST surface under {@code /api/v1}: node reads, fire-and-forget writes, tag export and the
 * hub's client list. Data endpoints answer 503 while no session is connected.
 */
public final class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);
    public static final String BASE_PATH = "/api/v1";
    private static final String NOT_CONNECTED = "OPC UA connection is not active";

    private final SessionController controller;
    private final Supplier<List<ClientInfo>> hubClients;
    private HttpServer server;

    public ApiServer(SessionController controller, Supplier<List<ClientInfo>> hubClients) {
        this.controller = controller;
        this.hubClients = hubClients;
    }

    public synchronized void start(int port) throws IOException {
        if (server != null) {
            return;
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(port), 0);
        created.createContext(BASE_PATH + "/read", exchange -> handle(exchange, this::read));
        created.createContext(BASE_PATH + "/write", exchange -> handle(exchange, this::write));
        created.createContext(BASE_PATH + "/export/tags", exchange -> handle(exchange, this::exportTags));
        created.createContext(BASE_PATH + "/ws/clients", exchange -> handle(exchange, this::wsClients));
        created.setExecutor(null);
        created.start();
        server = created;
        log.info("API server listening on http://0.0.0.0:{}{}", port(), BASE_PATH);
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    public synchronized int port() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(1);
        server = null;
        log.info("API server stopped");
    }

    @FunctionalInterface
    private interface Route {
        void serve(HttpExchange exchange) throws IOException;
    }

    private static void handle(HttpExchange exchange, Route route) throws IOException {
        try {
            route.serve(exchange);
        } catch (RuntimeException e) {
            log.error("Unhandled error on {}", exchange.getRequestURI().getPath(), e);
            writeJson(exchange, Map.of("error", String.valueOf(e.getMessage())), 500);
        } finally {
            exchange.close();
        }
    }

    private void read(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "POST") || !requireConnected(exchange)) {
            return;
        }
        JsonNode body = readBody(exchange);
        String nodeId = text(body, "node_id");
        if (nodeId.isEmpty()) {
            writeJson(exchange, Map.of("error", "node_id is required"), 400);
            return;
        }
        try {
            NodeAttributes attributes = controller.readNodeAttributes(nodeId);
            writeJson(exchange, attributes, 200);
        } catch (ProtocolException e) {
            int status = e.kind() == ProtocolException.Kind.NOT_CONNECTED ? 503 : 500;
            writeJson(exchange, Map.of("error", String.valueOf(e.getMessage())), status);
        }
    }

    private void write(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "POST") || !requireConnected(exchange)) {
            return;
        }
        JsonNode body = readBody(exchange);
        String nodeId = text(body, "node_id");
        String dataType = text(body, "data_type");
        if (nodeId.isEmpty() || dataType.isEmpty() || body == null || !body.hasNonNull("value")) {
            writeJson(exchange, Map.of("error", "node_id, data_type and value are required"), 400);
            return;
        }
        String value = body.get("value").asText();
        controller.writeValue(nodeId, dataType, value).thenAccept(ApiServer::logOutcome);
        writeJson(exchange, Map.of("status", "write request sent"), 200);
    }

    private static void logOutcome(WriteOutcome outcome) {
        if (outcome.success()) {
            log.debug("API write to {} completed after {} attempt(s)", outcome.nodeId(), outcome.attempts());
        } else {
            log.warn("API write to {} failed: {}", outcome.nodeId(), outcome.error());
        }
    }

    // Serves both /export/tags and /export/tags/folder; the context matches by prefix.
    private void exportTags(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET") || !requireConnected(exchange)) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        Map<String, String> query = parseQuery(exchange.getRequestURI());
        String format = query.getOrDefault("format", "json").trim().toLowerCase(Locale.ROOT);
        if (format.isEmpty()) {
            format = "json";
        }
        if (!format.equals("json") && !format.equals("csv")) {
            writeJson(exchange, Map.of("error", "unsupported format: " + format), 400);
            return;
        }
        String parentId = "";
        boolean recursive = true;
        String filename = "tags_all.csv";
        if (path.equals(BASE_PATH + "/export/tags/folder")) {
            parentId = query.getOrDefault("node_id", "").trim();
            if (parentId.isEmpty()) {
                writeJson(exchange, Map.of("error", "node_id is required"), 400);
                return;
            }
            String flag = query.getOrDefault("recursive", "");
            recursive = !flag.equals("false") && !flag.equals("0");
            filename = "tags_folder.csv";
        } else if (!path.equals(BASE_PATH + "/export/tags")) {
            writeJson(exchange, Map.of("error", "not found"), 404);
            return;
        }

        TagCollection collected = controller.collectVariableNodes(parentId, recursive);
        if (!collected.complete()) {
            if (TagCollection.TIMEOUT_ERROR.equals(collected.error())) {
                Map<String, Object> partial = new LinkedHashMap<>();
                partial.put("error", collected.error());
                partial.put("partial", collected.tags());
                writeJson(exchange, partial, 504);
            } else {
                writeJson(exchange, Map.of("error", collected.error()), 500);
            }
            return;
        }
        if (format.equals("csv")) {
            writeCsv(exchange, collected.tags(), filename);
        } else {
            writeJson(exchange, collected.tags(), 200);
        }
    }

    private void wsClients(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        writeJson(exchange, hubClients.get(), 200);
    }

    private boolean requireConnected(HttpExchange exchange) throws IOException {
        if (controller.isConnected()) {
            return true;
        }
        writeJson(exchange, Map.of("error", NOT_CONNECTED), 503);
        return false;
    }

    private static void writeCsv(HttpExchange exchange, List<TagExportRecord> tags, String filename) throws IOException {
        byte[] bytes = TagCsv.render(tags).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/csv; charset=utf-8");
        exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=" + filename);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
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

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        if (method == null) {
            writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
            return false;
        }
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", method), 405);
        return false;
    }

    // Null when the body is empty or not a JSON object.
    private static JsonNode readBody(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            log.debug("Rejected request body: {}", e.getMessage());
            return null;
        }
    }

    private static String text(JsonNode body, String field) {
        if (body == null) {
            return "";
        }
        JsonNode value = body.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }
}
