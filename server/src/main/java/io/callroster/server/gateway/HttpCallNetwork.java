// file: src/main/java/io/callroster/server/gateway/HttpCallNetwork.java
package io.callroster.server.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.callroster.core.MuteState;
import io.callroster.core.PeerId;
import io.callroster.core.update.Update;
import io.callroster.server.DtoMapper;
import io.callroster.server.dto.CallSettingsRequest;
import io.callroster.server.dto.ParticipantDto;
import io.callroster.server.dto.ParticipantsPageDto;
import io.callroster.server.dto.UpdateDto;
import io.callroster.sync.net.CallNetwork;
import io.callroster.sync.net.CallNetworkException;
import io.callroster.sync.net.ParticipantsPage;
import io.callroster.sync.peer.InMemoryPeerDirectory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * {@link CallNetwork} over a JSON/HTTP call gateway.
 *
 * Endpoints used:
 *
 *   GET  /calls/{id}/participants?offset=...&limit=...[&ssrcs=1,2,3][&sortAscending=true]
 *   POST /calls/{id}/participants/{peerId}     body: EditParticipantRequest
 *   POST /calls/{id}/recording                 body: { "record": true, "title": "..." }
 *   POST /calls/{id}/settings                  body: { "defaultMuted": true } or { "resetInviteLink": true }
 *
 * Mutation endpoints answer with a JSON array of {@link UpdateDto}.
 *
 * This class:
 *   - performs the requests asynchronously,
 *   - parses JSON with Jackson,
 *   - registers the peers carried by every response in the peer directory
 *     before the engine sees them,
 *   - reports non-2xx answers, I/O errors and bad JSON as {@link CallNetworkException}.
 */
public final class HttpCallNetwork implements CallNetwork {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<UpdateDto>> UPDATES = new TypeReference<>() {};

    private final URI baseUri;
    private final PeerId viewer;
    private final InMemoryPeerDirectory peers;
    private final HttpClient client;
    private final Duration timeout;

    public HttpCallNetwork(URI baseUri, PeerId viewer, InMemoryPeerDirectory peers) {
        this(baseUri, viewer, peers, Duration.ofSeconds(10));
    }

    public HttpCallNetwork(URI baseUri, PeerId viewer, InMemoryPeerDirectory peers, Duration timeout) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.viewer = Objects.requireNonNull(viewer, "viewer");
        this.peers = Objects.requireNonNull(peers, "peers");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public CompletableFuture<ParticipantsPage> fetchParticipants(
            long callId, String offset, Set<Long> ssrcs, int limit, Boolean sortAscending) {
        StringBuilder query = new StringBuilder()
                .append("offset=").append(encode(offset == null ? "" : offset))
                .append("&limit=").append(limit);
        if (!ssrcs.isEmpty()) {
            String list = ssrcs.stream().sorted().map(String::valueOf).collect(Collectors.joining(","));
            query.append("&ssrcs=").append(encode(list));
        }
        if (sortAscending != null) {
            query.append("&sortAscending=").append(sortAscending);
        }
        URI uri = baseUri.resolve("/calls/" + callId + "/participants?" + query);

        return send(HttpRequest.newBuilder(uri).timeout(timeout).GET().build(), "fetch participants of call " + callId)
                .thenApply(body -> {
                    ParticipantsPageDto dto = read(body, ParticipantsPageDto.class, callId);
                    if (dto.participants != null) {
                        for (ParticipantDto p : dto.participants) {
                            peers.put(DtoMapper.peerRecord(p));
                        }
                    }
                    return DtoMapper.page(dto);
                });
    }

    @Override
    public CompletableFuture<List<Update>> editParticipant(
            long callId, PeerId peerId, MuteState muteState, Integer volume, Boolean raiseHand) {
        var req = DtoMapper.editRequest(viewer, peerId, muteState, volume, raiseHand);
        return post(callId, "/calls/" + callId + "/participants/" + peerId.value(), req,
                "edit participant " + peerId + " in call " + callId);
    }

    @Override
    public CompletableFuture<List<Update>> toggleRecording(long callId, boolean shouldRecord, String title) {
        var req = new CallSettingsRequest();
        req.record = shouldRecord;
        req.title = title == null || title.isEmpty() ? null : title;
        return post(callId, "/calls/" + callId + "/recording", req, "toggle recording of call " + callId);
    }

    @Override
    public CompletableFuture<List<Update>> toggleDefaultMuted(long callId, boolean isMuted) {
        var req = new CallSettingsRequest();
        req.defaultMuted = isMuted;
        return post(callId, "/calls/" + callId + "/settings", req, "toggle default mute of call " + callId);
    }

    @Override
    public CompletableFuture<List<Update>> resetInviteLinks(long callId) {
        var req = new CallSettingsRequest();
        req.resetInviteLink = true;
        return post(callId, "/calls/" + callId + "/settings", req, "reset invite links of call " + callId);
    }

    // ---------- plumbing ----------

    private CompletableFuture<List<Update>> post(long callId, String path, Object body, String what) {
        byte[] json;
        try {
            json = MAPPER.writeValueAsBytes(body);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new CallNetworkException("Failed to encode request to " + what, e));
        }
        HttpRequest req = HttpRequest.newBuilder(baseUri.resolve(path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json))
                .build();
        return send(req, what).thenApply(resp -> {
            List<UpdateDto> dtos = read(resp, UPDATES, callId);
            peers.putAll(DtoMapper.peerRecords(dtos));
            return DtoMapper.updatesFor(callId, dtos);
        });
    }

    private CompletableFuture<String> send(HttpRequest req, String what) {
        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                        throw new CallNetworkException("Failed to " + what, cause);
                    }
                    if (resp.statusCode() / 100 != 2) {
                        throw new CallNetworkException("Gateway returned HTTP " + resp.statusCode() + " to " + what);
                    }
                    return resp.body();
                });
    }

    private static <T> T read(String body, Class<T> type, long callId) {
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new CallNetworkException("Undecodable gateway response for call " + callId, e);
        }
    }

    private static <T> T read(String body, TypeReference<T> type, long callId) {
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new CallNetworkException("Undecodable gateway response for call " + callId, e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
