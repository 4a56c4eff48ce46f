package net.spookly.rtctoken.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import net.spookly.rtctoken.config.RtcTokenConfig;
import net.spookly.rtctoken.token.CombinedTokenArtifact;
import net.spookly.rtctoken.token.TokenArtifact;
import net.spookly.rtctoken.token.TokenComposer;
import net.spookly.rtctoken.token.TokenError;
import net.spookly.rtctoken.token.TokenRequest;
import net.spookly.rtctoken.token.TokenResult;
import net.spookly.rtctoken.usage.DailyUsage;
import net.spookly.rtctoken.usage.UsageReport;
import net.spookly.rtctoken.usage.UsageRequests;
import net.spookly.rtctoken.usage.UsageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front end for token issuance and usage reporting.
 */
public final class TokenServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TokenServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final String DEFAULT_HOST = "0.0.0.0";
    static final int DEFAULT_PORT = 8080;
    static final int DEFAULT_WORKER_THREADS = 4;
    static final int DEFAULT_MAX_REQUEST_BYTES = 64 * 1024;
    static final String DEFAULT_CORS_ORIGIN = "*";

    private final TokenComposer composer;
    private final UsageStore usageStore;
    private final HttpServer server;
    private final ExecutorService executor;
    private final int maxRequestBytes;
    private final String corsAllowOrigin;

    public TokenServer(RtcTokenConfig config, TokenComposer composer, UsageStore usageStore) {
        this(
                socketAddress(config),
                config.server.workerThreads != null ? config.server.workerThreads : DEFAULT_WORKER_THREADS,
                config.server.maxRequestBytes != null ? config.server.maxRequestBytes : DEFAULT_MAX_REQUEST_BYTES,
                config.server.corsAllowOrigin != null ? config.server.corsAllowOrigin : DEFAULT_CORS_ORIGIN,
                composer,
                usageStore
        );
    }

    TokenServer(InetSocketAddress address,
                int workerThreads,
                int maxRequestBytes,
                String corsAllowOrigin,
                TokenComposer composer,
                UsageStore usageStore) {
        this.composer = Objects.requireNonNull(composer, "composer");
        this.usageStore = Objects.requireNonNull(usageStore, "usageStore");
        this.maxRequestBytes = maxRequestBytes;
        this.corsAllowOrigin = corsAllowOrigin;
        try {
            this.server = HttpServer.create(address, 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind token server listener", e);
        }
        this.executor = Executors.newFixedThreadPool(workerThreads);
        this.server.setExecutor(executor);
        this.server.createContext("/ping", new PingHandler());
        this.server.createContext("/rtc/", new RtcTokenHandler());
        this.server.createContext("/rtm/", new RtmTokenHandler());
        this.server.createContext("/rte/", new RteTokenHandler());
        this.server.createContext("/usage/save", new UsageSaveHandler());
        this.server.createContext("/usage/get", new UsageGetHandler());
        this.server.createContext("/", new NotFoundHandler());
    }

    /**
     * Start accepting requests.
     */
    public void start() {
        server.start();
        LOGGER.info("Token server listening on {}:{}", server.getAddress().getHostString(), port());
    }

    /**
     * Stop the listener and its worker pool.
     */
    public void stop() {
        server.stop(0);
        executor.shutdownNow();
        LOGGER.info("Token server stopped");
    }

    /**
     * Bound port; differs from the configured one when binding to port 0.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    private static InetSocketAddress socketAddress(RtcTokenConfig config) {
        RtcTokenConfig.ServerConfig serverConfig = config.server;
        String host = serverConfig.host != null ? serverConfig.host : DEFAULT_HOST;
        int port = serverConfig.port != null ? serverConfig.port : DEFAULT_PORT;
        return new InetSocketAddress(host, port);
    }

    private abstract class BaseHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                exchange.getResponseHeaders().add("Access-Control-Allow-Origin", corsAllowOrigin);
                if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writePreflight(exchange);
                    return;
                }
                String exactPath = exactPath();
                if (exactPath != null && !exactPath.equals(exchange.getRequestURI().getRawPath())) {
                    writeError(exchange, 404, "not found");
                    return;
                }
                if (!allowedMethod().equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeError(exchange, 405, "method not allowed");
                    return;
                }
                handleRequest(exchange);
            } catch (RequestTooLargeException e) {
                writeError(exchange, 413, "request too large");
            } catch (IllegalArgumentException e) {
                writeError(exchange, 400, e.getMessage() != null ? e.getMessage() : "bad request");
            } catch (Exception e) {
                LOGGER.error("Request failed: {} {}", exchange.getRequestMethod(), exchange.getRequestURI().getRawPath(), e);
                writeError(exchange, 500, "internal error");
            } finally {
                exchange.close();
            }
        }

        protected String allowedMethod() {
            return "GET";
        }

        /**
         * Path the handler answers exactly, or {@code null} to accept every path under its context.
         */
        protected String exactPath() {
            return null;
        }

        protected abstract void handleRequest(HttpExchange exchange) throws IOException;

        protected void writeError(HttpExchange exchange, int status, String message) throws IOException {
            writeJson(exchange, status, Map.of("error", message));
        }

        protected <T> T readJson(byte[] payload, Class<T> type) throws IOException {
            if (payload == null || payload.length == 0) {
                throw new IllegalArgumentException("request body required");
            }
            try {
                return MAPPER.readValue(payload, type);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("invalid json");
            }
        }

        protected byte[] readBodyBytes(HttpExchange exchange) throws IOException {
            try (InputStream input = exchange.getRequestBody()) {
                if (input == null) {
                    return new byte[0];
                }
                ByteArrayOutputStream output = new ByteArrayOutputStream();
                byte[] buffer = new byte[8192];
                int total = 0;
                int read;
                while ((read = input.read(buffer)) != -1) {
                    total += read;
                    if (total > maxRequestBytes) {
                        throw new RequestTooLargeException();
                    }
                    output.write(buffer, 0, read);
                }
                return output.toByteArray();
            }
        }
    }

    /**
     * Token routes: path parameters, {@code expiry} query parameter and no-cache headers.
     */
    private abstract class TokenHandler extends BaseHandler {
        private final String prefix;
        private final int segmentCount;

        private TokenHandler(String prefix, int segmentCount) {
            this.prefix = prefix;
            this.segmentCount = segmentCount;
        }

        @Override
        protected final void handleRequest(HttpExchange exchange) throws IOException {
            List<String> segments = pathSegments(exchange.getRequestURI(), prefix, segmentCount);
            if (segments == null) {
                writeError(exchange, 404, "not found");
                return;
            }
            String expiry = parseQueryParams(exchange.getRequestURI()).get("expiry");
            Headers headers = exchange.getResponseHeaders();
            headers.add("Cache-Control", "private, no-cache, no-store, must-revalidate");
            headers.add("Expires", "-1");
            headers.add("Pragma", "no-cache");
            try {
                handleToken(exchange, segments, expiry);
            } catch (RuntimeException e) {
                // Input problems come back as TokenError; anything thrown is a signing failure.
                LOGGER.error("Token signing failed: {}", exchange.getRequestURI().getRawPath(), e);
                writeError(exchange, 500, "internal error");
            }
        }

        protected abstract void handleToken(HttpExchange exchange, List<String> segments, String expiry) throws IOException;

        protected void writeTokenError(HttpExchange exchange, TokenError error) throws IOException {
            writeError(exchange, error.clientError() ? 400 : 500, error.message());
        }
    }

    private final class PingHandler extends BaseHandler {
        @Override
        protected String exactPath() {
            return "/ping";
        }

        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            exchange.getResponseHeaders().add("Cache-Control", "private, no-cache, no-store, must-revalidate");
            writeJson(exchange, 200, Map.of("message", "pong"));
        }
    }

    private final class RtcTokenHandler extends TokenHandler {
        private RtcTokenHandler() {
            super("/rtc/", 4);
        }

        @Override
        protected void handleToken(HttpExchange exchange, List<String> segments, String expiry) throws IOException {
            TokenRequest request = TokenRequest.media(segments.get(0), segments.get(3), segments.get(1), segments.get(2), expiry);
            TokenResult<TokenArtifact> result = composer.composeMediaToken(request);
            if (!result.ok()) {
                writeTokenError(exchange, result.error());
                return;
            }
            writeJson(exchange, 200, Map.of("rtcToken", result.value().token()));
        }
    }

    private final class RtmTokenHandler extends TokenHandler {
        private RtmTokenHandler() {
            super("/rtm/", 1);
        }

        @Override
        protected void handleToken(HttpExchange exchange, List<String> segments, String expiry) throws IOException {
            TokenResult<TokenArtifact> result = composer.composeMessagingToken(TokenRequest.messaging(segments.get(0), expiry));
            if (!result.ok()) {
                writeTokenError(exchange, result.error());
                return;
            }
            writeJson(exchange, 200, Map.of("rtmToken", result.value().token()));
        }
    }

    private final class RteTokenHandler extends TokenHandler {
        private RteTokenHandler() {
            super("/rte/", 4);
        }

        @Override
        protected void handleToken(HttpExchange exchange, List<String> segments, String expiry) throws IOException {
            TokenRequest request = TokenRequest.combined(segments.get(0), segments.get(3), segments.get(1), expiry);
            TokenResult<CombinedTokenArtifact> result = composer.composeCombinedToken(request);
            if (!result.ok()) {
                writeTokenError(exchange, result.error());
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("rtcToken", result.value().rtc().token());
            data.put("rtmToken", result.value().rtm().token());
            writeJson(exchange, 200, data);
        }
    }

    /**
     * Usage routes answer failures with {@code {"ok": false}}.
     */
    private abstract class UsageHandler extends BaseHandler {
        @Override
        protected void writeError(HttpExchange exchange, int status, String message) throws IOException {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("ok", false);
            if (status < 500) {
                data.put("error", message);
            }
            writeJson(exchange, status, data);
        }
    }

    private final class UsageSaveHandler extends UsageHandler {
        @Override
        protected String exactPath() {
            return "/usage/save";
        }

        @Override
        protected String allowedMethod() {
            return "POST";
        }

        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            UsageRequests.SaveRequest request = readJson(readBodyBytes(exchange), UsageRequests.SaveRequest.class);
            usageStore.save(UsageReport.from(request));
            writeJson(exchange, 200, Map.of("ok", true));
        }
    }

    private final class UsageGetHandler extends UsageHandler {
        @Override
        protected String exactPath() {
            return "/usage/get";
        }

        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            String uid = parseQueryParams(exchange.getRequestURI()).get("uid");
            if (uid == null || uid.trim().isEmpty()) {
                throw new IllegalArgumentException("uid is required");
            }
            writeJson(exchange, 200, toView(usageStore.recent(uid)));
        }
    }

    private final class NotFoundHandler extends BaseHandler {
        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            writeError(exchange, 404, "not found");
        }
    }

    private void writePreflight(HttpExchange exchange) throws IOException {
        Headers headers = exchange.getResponseHeaders();
        headers.add("Access-Control-Allow-Methods", "GET,HEAD,PUT,PATCH,POST,DELETE");
        String requested = exchange.getRequestHeaders().getFirst("Access-Control-Request-Headers");
        if (requested != null && !requested.isEmpty()) {
            headers.add("Access-Control-Allow-Headers", requested);
        }
        exchange.sendResponseHeaders(204, -1);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }

    /**
     * Decoded path segments after the prefix, or {@code null} when the count does not match.
     * One trailing slash is tolerated.
     */
    static List<String> pathSegments(URI uri, String prefix, int expected) {
        String path = uri.getRawPath();
        if (path == null || !path.startsWith(prefix)) {
            return null;
        }
        List<String> raw = new ArrayList<>(Arrays.asList(path.substring(prefix.length()).split("/", -1)));
        if (raw.size() == expected + 1 && raw.get(expected).isEmpty()) {
            raw.remove(expected);
        }
        if (raw.size() != expected) {
            return null;
        }
        List<String> decoded = new ArrayList<>(expected);
        for (String segment : raw) {
            decoded.add(decodeSegment(segment));
        }
        return decoded;
    }

    private static String decodeSegment(String segment) {
        // '+' is literal in a path segment.
        return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    static Map<String, String> parseQueryParams(URI uri) {
        String raw = uri.getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, String> params = new HashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] parts = pair.split("=", 2);
            String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
            String value = parts.length > 1 ? URLDecoder.decode(parts[1], StandardCharsets.UTF_8) : "";
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private List<Map<String, Object>> toView(List<DailyUsage> rows) {
        List<Map<String, Object>> view = new ArrayList<>();
        for (DailyUsage row : rows) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("date", row.date().toString());
            item.put("total_call_time", row.totalCallTime());
            item.put("call_count", row.callCount());
            item.put("screen_time", row.screenTime());
            item.put("last_location", row.lastLocation());
            view.add(item);
        }
        return view;
    }

    private static final class RequestTooLargeException extends RuntimeException {
        private RequestTooLargeException() {
            super("request too large");
        }
    }
}
