// file: server/src/test/java/io/callroster/server/WebServerTest.java
package io.callroster.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.callroster.core.MuteState;
import io.callroster.core.Participant;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerId;
import io.callroster.core.PeerRecord;
import io.callroster.core.update.Update;
import io.callroster.server.gateway.PushUpdateFeed;
import io.callroster.sync.ParticipantsContext;
import io.callroster.sync.SyncConfig;
import io.callroster.sync.SyncEnvironment;
import io.callroster.sync.net.CallNetwork;
import io.callroster.sync.net.ParticipantsPage;
import io.callroster.sync.peer.InMemoryPeerDirectory;
import io.callroster.sync.queue.ExecutorCallQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the push/debug HTTP API.
 *
 * Focus:
 *  - Routing and error mapping (400/404/405/413).
 *  - Pushed updates reach the call's context and show up in the roster read.
 *  - Speaking reports and load-more are forwarded to the context.
 */
class WebServerTest {

    private static final int PORT = 18080; // test-only port
    private static final long CALL = 42L;
    private static final PeerId VIEWER = PeerId.of(1);

    private final ObjectMapper json = new ObjectMapper();

    private ExecutorCallQueue queue;
    private CallRegistry calls;
    private FakeNetwork network;
    private ParticipantsContext ctx;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        var peers = new InMemoryPeerDirectory();
        peers.put(new PeerRecord(PeerId.of(7), "Ann"));
        var feed = new PushUpdateFeed();
        network = new FakeNetwork();
        queue = new ExecutorCallQueue("web-test");

        var ann = new Participant(PeerId.of(7), 70L, null, 1000, null, null, null, null, null, null);
        var initial = ParticipantsState.fromFetch(List.of(ann), "p2", false, 5, 1);
        var env = new SyncEnvironment(network, peers, feed, null, queue, Clock.systemUTC(), SyncConfig.defaults());
        ctx = new ParticipantsContext(CALL, VIEWER, initial, null, env);

        calls = new CallRegistry();
        calls.register(ctx);

        server = new WebServer(PORT, calls, feed, peers);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
        calls.closeAll();
        queue.shutdown();
    }

    @Test
    void health_reports_followed_calls() throws Exception {
        HttpResponse<String> resp = get("/admin/health");

        assertEquals(200, resp.statusCode());
        JsonNode body = json.readTree(resp.body());
        assertEquals("ok", body.get("status").asText());
        assertEquals(1, body.get("calls").asInt());
    }

    @Test
    void roster_read_returns_effective_state_with_display_names() throws Exception {
        HttpResponse<String> resp = get("/calls/42/participants");

        assertEquals(200, resp.statusCode());
        JsonNode body = json.readTree(resp.body());
        assertEquals(42, body.get("callId").asLong());
        assertEquals(1, body.get("version").asInt());
        assertEquals(5, body.get("totalCount").asInt());
        assertEquals("p2", body.get("nextFetchOffset").asText());
        JsonNode first = body.get("participants").get(0);
        assertEquals(7, first.get("peerId").asLong());
        assertEquals("Ann", first.get("displayName").asText());
        assertFalse(first.get("muted").asBoolean());
    }

    @Test
    void pushed_delta_is_applied_to_the_context() throws Exception {
        String body = """
                [
                  {
                    "type": "state",
                    "version": 2,
                    "participants": [
                      { "peerId": 9, "displayName": "Bob", "ssrc": 90, "joinTimestamp": 1100,
                        "justJoined": true, "muted": true, "canSelfUnmute": true }
                    ]
                  },
                  { "type": "state", "callId": 43, "version": 7, "participants": [] }
                ]
                """;

        HttpResponse<String> resp = post("/calls/42/updates", body);

        assertEquals(200, resp.statusCode());
        assertEquals(1, json.readTree(resp.body()).get("accepted").asInt(), "other call's update is dropped");
        awaitTrue(() -> ctx.immediateState().version() == 2);
        Participant bob = ctx.immediateState().find(PeerId.of(9)).orElseThrow();
        assertEquals(new MuteState(true, false), bob.muteState());

        JsonNode roster = json.readTree(get("/calls/42/participants").body());
        boolean named = false;
        for (JsonNode p : roster.get("participants")) {
            if (p.get("peerId").asLong() == 9) {
                named = "Bob".equals(p.get("displayName").asText());
            }
        }
        assertTrue(named, "peer record registered from the push");
    }

    @Test
    void pushed_settings_mark_call_terminated() throws Exception {
        HttpResponse<String> resp = post("/calls/42/updates",
                "[ { \"type\": \"settings\", \"terminated\": true, \"title\": \"standup\" } ]");

        assertEquals(200, resp.statusCode());
        awaitTrue(() -> ctx.isTerminated());
        awaitTrue(() -> "standup".equals(ctx.immediateState().title()));
    }

    @Test
    void speaking_report_assigns_activity_rank() throws Exception {
        HttpResponse<String> resp = post("/calls/42/speaking", "{ \"7\": 70 }");

        assertEquals(200, resp.statusCode());
        awaitTrue(() -> ctx.immediateState().find(PeerId.of(7)).orElseThrow().activityRank() != null);
        assertEquals(0, ctx.immediateState().find(PeerId.of(7)).orElseThrow().activityRank());
        assertEquals(1, ctx.serviceState().nextActivityRank());
    }

    @Test
    void load_more_fetches_next_page() throws Exception {
        HttpResponse<String> resp = post("/calls/42/load-more", "{ \"token\": \"p2\" }");

        assertEquals(200, resp.statusCode());
        awaitTrue(() -> ctx.immediateState().find(PeerId.of(11)).isPresent());
        assertEquals(List.of("p2"), network.offsets);
        assertNull(ctx.immediateState().nextFetchOffset());
        assertEquals(1, ctx.immediateState().version(), "pagination does not move the version");
    }

    @Test
    void admin_list_update_reveals_raised_hands() throws Exception {
        post("/calls/42/updates", """
                [ { "type": "state", "version": 2,
                    "participants": [ { "peerId": 7, "ssrc": 70, "joinTimestamp": 1000, "raiseHandRating": 4 } ] } ]
                """);
        awaitTrue(() -> ctx.immediateState().version() == 2);
        assertNull(ctx.immediateState().find(PeerId.of(7)).orElseThrow().raiseHandRating(), "hidden from members");

        HttpResponse<String> resp = post("/calls/42/admins", "{ \"adminIds\": [1, 5] }");

        assertEquals(200, resp.statusCode());
        assertEquals(2, json.readTree(resp.body()).get("accepted").asInt());
        awaitTrue(() -> ctx.immediateState().adminIds().contains(VIEWER));
        assertEquals(4L, ctx.immediateState().find(PeerId.of(7)).orElseThrow().raiseHandRating());
    }

    @Test
    void admin_list_is_required() throws Exception {
        HttpResponse<String> resp = post("/calls/42/admins", "{}");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("adminIds is required"));
    }

    @Test
    void load_more_without_token_returns_400() throws Exception {
        HttpResponse<String> resp = post("/calls/42/load-more", "{ \"token\": \"\" }");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("token must not be empty"));
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        HttpResponse<String> resp = post("/calls/42/updates", "[ { invalid-json");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void unknown_update_type_returns_400() throws Exception {
        HttpResponse<String> resp = post("/calls/42/updates", "[ { \"type\": \"mystery\" } ]");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("unknown update type"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        String big = "x".repeat(2 * 1024 * 1024);

        HttpResponse<String> resp = post("/calls/42/updates", big);

        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void unknown_call_and_path_return_404() throws Exception {
        assertEquals(404, get("/calls/7/participants").statusCode());
        assertEquals(404, get("/calls/42/whatever").statusCode());
        assertEquals(404, get("/nope").statusCode());
    }

    @Test
    void malformed_call_id_returns_400() throws Exception {
        HttpResponse<String> resp = get("/calls/abc/participants");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("call id must be a number"));
    }

    @Test
    void wrong_method_returns_405() throws Exception {
        assertEquals(405, get("/calls/42/updates").statusCode());
        assertEquals(405, post("/calls/42/participants", "{}").statusCode());
    }

    // ---------- helpers ----------

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** Pushes are applied on the call queue; poll until the effect is visible. */
    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    /** Serves one extra page for offset "p2"; everything else is empty. Mutations are not exercised. */
    private static final class FakeNetwork implements CallNetwork {
        final List<String> offsets = new CopyOnWriteArrayList<>();

        @Override
        public CompletableFuture<ParticipantsPage> fetchParticipants(
                long callId, String offset, Set<Long> ssrcs, int limit, Boolean sortAscending) {
            offsets.add(offset);
            if ("p2".equals(offset)) {
                var cy = new Participant(PeerId.of(11), 110L, null, 1200, null, null, null, null, null, null);
                return CompletableFuture.completedFuture(new ParticipantsPage(List.of(cy), null, 5, 1, false));
            }
            return CompletableFuture.completedFuture(new ParticipantsPage(List.of(), null, 5, 1, false));
        }

        @Override
        public CompletableFuture<List<Update>> editParticipant(
                long callId, PeerId peerId, MuteState muteState, Integer volume, Boolean raiseHand) {
            return CompletableFuture.completedFuture(List.of());
        }

        @Override
        public CompletableFuture<List<Update>> toggleRecording(long callId, boolean shouldRecord, String title) {
            return CompletableFuture.completedFuture(List.of());
        }

        @Override
        public CompletableFuture<List<Update>> toggleDefaultMuted(long callId, boolean isMuted) {
            return CompletableFuture.completedFuture(List.of());
        }

        @Override
        public CompletableFuture<List<Update>> resetInviteLinks(long callId) {
            return CompletableFuture.completedFuture(List.of());
        }
    }
}
