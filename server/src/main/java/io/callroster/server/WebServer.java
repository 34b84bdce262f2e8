// file: src/main/java/io/callroster/server/WebServer.java
package io.callroster.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.callroster.core.PeerId;
import io.callroster.core.update.Update;
import io.callroster.server.dto.AdminIdsRequest;
import io.callroster.server.dto.LoadMoreRequest;
import io.callroster.server.dto.UpdateDto;
import io.callroster.server.gateway.PushUpdateFeed;
import io.callroster.sync.ParticipantsContext;
import io.callroster.sync.net.ScopedUpdate;
import io.callroster.sync.peer.InMemoryPeerDirectory;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Thin HTTP adapter over the call contexts of this process.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Hand pushes and reports to the right {@link ParticipantsContext}.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /calls/{callId}/updates       JSON array of updates pushed by the gateway
 *   - POST /calls/{callId}/speaking      { "peerId": ssrc, ... } speaking report
 *   - GET  /calls/{callId}/participants  effective roster of the viewer
 *   - POST /calls/{callId}/load-more     { "token": "..." } load the next page
 *   - POST /calls/{callId}/admins        { "adminIds": [...] } replace the admin list
 *   - GET  /admin/health                 basic health check
 *
 * Pushes and reports are applied asynchronously on the call's queue, so a
 * 200 means "accepted", not "applied".
 */
public final class WebServer {

    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    private static final TypeReference<List<UpdateDto>> UPDATES = new TypeReference<>() {};
    private static final TypeReference<Map<String, Long>> SPEAKERS = new TypeReference<>() {};

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final CallRegistry calls;
    private final PushUpdateFeed feed;
    private final InMemoryPeerDirectory peers;

    public WebServer(int port, CallRegistry calls, PushUpdateFeed feed, InMemoryPeerDirectory peers) {
        this.calls = calls;
        this.feed = feed;
        this.peers = peers;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok", "calls", calls.all().size()));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else if (path.startsWith("/calls/")) {
                        routeCall(exchange, method, path);
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, -1, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    /** /calls/{callId}/{action} */
    private void routeCall(HttpServerExchange ex, String method, String path) {
        String[] parts = path.substring("/calls/".length()).split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            send(ex, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, 404, 0, -1, null);
            return;
        }

        long callId;
        try {
            callId = Long.parseLong(parts[0]);
        } catch (NumberFormatException nfe) {
            send(ex, 400, Map.of("error", "call id must be a number"));
            RequestLogger.logRequest(method, path, 400, 0, -1, null);
            return;
        }

        Optional<ParticipantsContext> ctx = calls.find(callId);
        if (ctx.isEmpty()) {
            send(ex, 404, Map.of("error", "unknown call " + callId));
            RequestLogger.logRequest(method, path, 404, 0, callId, null);
            return;
        }

        String action = parts[1];
        String expected = "participants".equals(action) ? "GET" : "POST";
        boolean known = switch (action) {
            case "updates", "speaking", "participants", "load-more", "admins" -> true;
            default -> false;
        };
        if (!known) {
            send(ex, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, 404, 0, callId, null);
            return;
        }
        if (!expected.equals(method)) {
            send(ex, 405, Map.of("error", "method not allowed"));
            RequestLogger.logRequest(method, path, 405, 0, callId, null);
            return;
        }

        switch (action) {
            case "participants" -> handleParticipants(ex, ctx.get());
            case "updates" -> withBody(ex, callId, data -> handleUpdates(callId, data));
            case "speaking" -> withBody(ex, callId, data -> handleSpeaking(ctx.get(), data));
            case "admins" -> withBody(ex, callId, data -> handleAdmins(ctx.get(), data));
            default -> withBody(ex, callId, data -> handleLoadMore(ctx.get(), data));
        }
    }

    // ---------- handlers ----------

    /** GET /calls/{callId}/participants */
    private void handleParticipants(HttpServerExchange ex, ParticipantsContext ctx) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            send(ex, status, DtoMapper.roster(ctx.callId(), ctx.immediateState(), peers, ctx.isTerminated()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, ctx.callId(), error);
        }
    }

    /** POST /calls/{callId}/updates */
    private Object handleUpdates(long callId, byte[] data) throws Exception {
        List<UpdateDto> dtos = json.readValue(data, UPDATES);
        if (dtos == null) {
            throw new IllegalArgumentException("body must be a JSON array of updates");
        }
        List<Update> updates = DtoMapper.updatesFor(callId, dtos);
        peers.putAll(DtoMapper.peerRecords(dtos));

        List<ScopedUpdate> batch = new ArrayList<>(updates.size());
        for (Update u : updates) {
            batch.add(new ScopedUpdate(callId, u));
        }
        feed.publish(batch);
        return Map.of("accepted", batch.size());
    }

    /** POST /calls/{callId}/speaking */
    private Object handleSpeaking(ParticipantsContext ctx, byte[] data) throws Exception {
        Map<String, Long> raw = json.readValue(data, SPEAKERS);
        if (raw == null) {
            throw new IllegalArgumentException("body must be a JSON object of peerId -> ssrc");
        }
        Map<PeerId, Long> speakers = new HashMap<>();
        for (Map.Entry<String, Long> e : raw.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException("ssrc missing for peer " + e.getKey());
            }
            speakers.put(PeerId.of(Long.parseLong(e.getKey())), e.getValue());
        }
        ctx.reportSpeakingParticipants(speakers);
        return Map.of("accepted", speakers.size());
    }

    /** POST /calls/{callId}/admins */
    private Object handleAdmins(ParticipantsContext ctx, byte[] data) throws Exception {
        AdminIdsRequest req = json.readValue(data, AdminIdsRequest.class);
        if (req == null || req.adminIds == null) {
            throw new IllegalArgumentException("adminIds is required");
        }
        Set<PeerId> ids = DtoMapper.peerIds(req.adminIds);
        ctx.updateAdminIds(ids);
        return Map.of("accepted", ids.size());
    }

    /** POST /calls/{callId}/load-more */
    private Object handleLoadMore(ParticipantsContext ctx, byte[] data) throws Exception {
        LoadMoreRequest req = json.readValue(data, LoadMoreRequest.class);
        if (req == null || req.token == null || req.token.isBlank()) {
            throw new IllegalArgumentException("token must not be empty");
        }
        ctx.loadMore(req.token);
        return Map.of("accepted", true);
    }

    // ---------- helpers ----------

    @FunctionalInterface
    private interface BodyHandler {
        Object handle(byte[] data) throws Exception;
    }

    /** Read the full body, run {@code handler} and map its outcome to a status code. */
    private void withBody(HttpServerExchange ex, long callId, BodyHandler handler) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String method = exchange.getRequestMethod().toString();
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            Object body = handler.handle(data);
                            status = 200;
                            send(exchange, status, body);
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest(method, path, exchange.getStatusCode(), totalMs, callId, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(), exchange.getRequestPath(),
                            status, 0, callId, ioEx);
                }
        );
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
