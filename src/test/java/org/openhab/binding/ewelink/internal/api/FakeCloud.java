package org.openhab.binding.ewelink.internal.api;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.model.RegionEndpoint;
import org.openhab.binding.ewelink.internal.util.RegionEndpointResolver;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Loopback stand-in for the eWeLink cloud. Every region is served under its own path prefix, e.g.
 * {@code http://127.0.0.1:port/us/v2/user/oauth/token}.
 */
@NonNullByDefault
@SuppressWarnings("null")
public final class FakeCloud implements AutoCloseable {

    public static final String AUTHORIZE_URL = "https://c2ccdn.coolkit.cc/oauth/index.html";

    private final HttpServer server;
    private final ExecutorService executor;
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private volatile Responder responder = request -> Reply.ok("{\"error\":0,\"data\":{}}");

    public FakeCloud() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/", this::handle);
        server.start();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String rawPath = exchange.getRequestURI().getPath();
        int slash = rawPath.indexOf('/', 1);
        String region = slash > 0 ? rawPath.substring(1, slash) : rawPath.substring(1);
        String path = slash > 0 ? rawPath.substring(slash) : "/";
        Request request = new Request(region, exchange.getRequestMethod(), path,
                exchange.getRequestURI().getQuery(), exchange.getRequestHeaders(), body);
        requests.add(request);

        Reply reply;
        try {
            reply = responder.respond(request);
        } catch (RuntimeException e) {
            reply = new Reply(500, "{\"error\":500,\"msg\":\"" + e.getMessage() + "\"}");
        }
        byte[] response = reply.body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(reply.status, response.length == 0 ? -1 : response.length);
        if (response.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        }
        exchange.close();
    }

    public void respond(Responder responder) {
        this.responder = responder;
    }

    public List<Request> requests() {
        return new ArrayList<>(requests);
    }

    public List<Request> requestsTo(String path) {
        return requests.stream().filter(r -> r.path.equals(path)).collect(Collectors.toList());
    }

    public String baseUrl(String regionId) {
        return "http://" + InetAddress.getLoopbackAddress().getHostAddress() + ":" + server.getAddress().getPort()
                + "/" + regionId;
    }

    public RegionEndpoint region(String regionId) {
        return new RegionEndpoint(regionId, baseUrl(regionId));
    }

    public RegionEndpointResolver resolver(String... regionIds) {
        List<RegionEndpoint> regions = new ArrayList<>();
        for (String id : regionIds) {
            regions.add(region(id));
        }
        return new RegionEndpointResolver(regions, AUTHORIZE_URL);
    }

    /**
     * Endpoint configuration in the format of {@code OH-INF/endpoints-defaults.json}.
     */
    public String endpointsJson(String... regionIds) {
        StringBuilder sb = new StringBuilder("{\"oauth\":{\"authorizeUrl\":\"" + AUTHORIZE_URL + "\"},\"regions\":[");
        for (int i = 0; i < regionIds.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append("{\"id\":\"").append(regionIds[i]).append("\",\"baseUrl\":\"").append(baseUrl(regionIds[i]))
                    .append("\"}");
        }
        return sb.append("]}").toString();
    }

    public static EWeLinkTransport transport() {
        return new EWeLinkTransport(Duration.ofSeconds(5));
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    @FunctionalInterface
    public interface Responder {
        Reply respond(Request request);
    }

    public static final class Request {
        public final String region;
        public final String method;
        public final String path;
        public final @Nullable String query;
        public final Headers headers;
        public final String body;

        Request(String region, String method, String path, @Nullable String query, Headers headers, String body) {
            this.region = region;
            this.method = method;
            this.path = path;
            this.query = query;
            this.headers = headers;
            this.body = body;
        }

        public @Nullable String header(String name) {
            return headers.getFirst(name);
        }

        public JsonObject json() {
            return JsonParser.parseString(body).getAsJsonObject();
        }
    }

    public static final class Reply {
        final int status;
        final String body;

        public Reply(int status, String body) {
            this.status = status;
            this.body = body;
        }

        public static Reply ok(String body) {
            return new Reply(200, body);
        }

        public static Reply signatureFailure() {
            return ok("{\"error\":401,\"msg\":\"sign verification failed\"}");
        }
    }
}
