// file: server/src/main/java/io/proxgraph/server/WebServer.java
package io.proxgraph.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.proxgraph.core.DevCapability;
import io.proxgraph.core.GraphException;
import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.PeerRef;
import io.proxgraph.core.SnapshotId;
import io.proxgraph.server.dto.*;
import io.proxgraph.storage.IdentityRegistry;
import io.proxgraph.storage.UserRecord;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Thin HTTP adapter over {@link ProximityService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Read the pre-authenticated caller from {@value #IDENTITY_HEADER}.
 *  - Stamp every mutation with the server clock.
 *  - Decode JSON request bodies into DTOs and encode results back to JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit basic per-request logging.
 *
 * Path layout (v1):
 *   - POST /users                      register caller
 *   - GET  /users/{userId}             current record
 *   - PUT  /users/{userId}/node        publish new neighbors (owner only)
 *   - GET  /users/{userId}/history     snapshot chain, newest first
 *   - GET  /snapshots/{id}             one frozen snapshot
 *   - GET  /registry                   registered identities in order
 *   - POST /dev/users                  spawn synthetic user (capability)
 *   - PUT  /dev/users/{userId}/node    synthetic update (capability)
 *   - GET  /admin/health               basic health check
 */
public final class WebServer {
    public static final String IDENTITY_HEADER = "X-Proxgraph-Identity";
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ProximityService service;
    private final Clock clock;

    public WebServer(int port, ProximityService service, Clock clock) {
        this.service = service;
        this.clock = clock;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        List<String> p = segments(ex.getRequestPath());

        if (p.equals(List.of("admin", "health"))) {
            handle(ex, method, "GET", () -> new Reply(200, Map.of("status", "ok")));
        } else if (p.equals(List.of("registry"))) {
            handle(ex, method, "GET", this::registry);
        } else if (p.equals(List.of("users"))) {
            handleBody(ex, method, "POST", NeighborsRequest.class, req -> register(ex, req));
        } else if (p.size() == 2 && p.get(0).equals("users")) {
            handle(ex, method, "GET", () -> new Reply(200, toUser(service.user(p.get(1)))));
        } else if (p.size() == 3 && p.get(0).equals("users") && p.get(2).equals("node")) {
            handleBody(ex, method, "PUT", NeighborsRequest.class, req -> update(ex, p.get(1), req));
        } else if (p.size() == 3 && p.get(0).equals("users") && p.get(2).equals("history")) {
            handle(ex, method, "GET", () -> history(p.get(1)));
        } else if (p.size() == 2 && p.get(0).equals("snapshots")) {
            handle(ex, method, "GET",
                    () -> new Reply(200, toSnapshot(service.snapshot(SnapshotId.parse(p.get(1))))));
        } else if (p.equals(List.of("dev", "users"))) {
            handleBody(ex, method, "POST", SpawnRequest.class, req -> spawn(ex, req));
        } else if (p.size() == 4 && p.get(0).equals("dev") && p.get(1).equals("users") && p.get(3).equals("node")) {
            handleBody(ex, method, "PUT", SyntheticUpdateRequest.class, req -> syntheticUpdate(ex, p.get(2), req));
        } else {
            send(ex, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, ex.getRequestPath(), 404, 0, -1, null);
        }
    }

    // ---------- operations ----------

    /** POST /users */
    private Reply register(HttpServerExchange ex, NeighborsRequest req) {
        Identity caller = caller(ex);
        UserRecord rec = service.registerUser(peers(req.neighbors), clock.millis(), caller);
        return new Reply(201, toUser(rec));
    }

    /** PUT /users/{userId}/node */
    private Reply update(HttpServerExchange ex, String userId, NeighborsRequest req) {
        Identity caller = caller(ex);
        service.updateNode(userId, peers(req.neighbors), clock.millis(), caller);
        return new Reply(200, toUser(service.user(userId)));
    }

    /** POST /dev/users */
    private Reply spawn(HttpServerExchange ex, SpawnRequest req) {
        Identity caller = caller(ex);
        if (req.target == null || req.target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        UserRecord rec = service.spawnSyntheticUser(
                presented(req.capabilityId, caller), new Identity(req.target), peers(req.neighbors), clock.millis(), caller);
        return new Reply(201, toUser(rec));
    }

    /** PUT /dev/users/{userId}/node */
    private Reply syntheticUpdate(HttpServerExchange ex, String userId, SyntheticUpdateRequest req) {
        Identity caller = caller(ex);
        service.syntheticUpdate(presented(req.capabilityId, caller), userId, peers(req.neighbors), clock.millis(), caller);
        return new Reply(200, toUser(service.user(userId)));
    }

    /** GET /users/{userId}/history */
    private Reply history(String userId) {
        var dto = new HistoryResponse();
        dto.userId = userId;
        dto.snapshots = new ArrayList<>();
        for (NodeSnapshot s : service.history(userId)) {
            dto.snapshots.add(toSnapshot(s));
        }
        return new Reply(200, dto);
    }

    /** GET /registry */
    private Reply registry() {
        IdentityRegistry reg = service.registry();
        var dto = new RegistryResponse();
        dto.registryId = reg.id();
        dto.creator = reg.creator().value();
        dto.registeredUsers = reg.registeredUsers().stream().map(Identity::value).toList();
        dto.userCount = service.userCount();
        return new Reply(200, dto);
    }

    // ---------- request plumbing ----------

    @FunctionalInterface
    private interface Call {
        Reply run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyCall<T> {
        Reply run(T body) throws Exception;
    }

    private record Reply(int status, Object body) {}

    /** Signals a request without the identity header. */
    private static final class MissingIdentityException extends RuntimeException {
        MissingIdentityException() {
            super(IDENTITY_HEADER + " header is required");
        }
    }

    private void handle(HttpServerExchange ex, String method, String allowed, Call call) {
        if (!allowed.equals(method)) {
            send(ex, 405, Map.of("error", "method not allowed"));
            RequestLogger.logRequest(method, ex.getRequestPath(), 405, 0, -1, null);
            return;
        }
        execute(ex, method, call);
    }

    private <T> void handleBody(HttpServerExchange ex, String method, String allowed, Class<T> type, BodyCall<T> call) {
        if (!allowed.equals(method)) {
            send(ex, 405, Map.of("error", "method not allowed"));
            RequestLogger.logRequest(method, ex.getRequestPath(), 405, 0, -1, null);
            return;
        }
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> execute(exchange, method, () -> {
                    if (data.length > MAX_BODY_BYTES) {
                        return new Reply(413, Map.of("error", "request body too large"));
                    }
                    return call.run(json.readValue(data, type));
                }),
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(method, exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    /** Run {@code call}, map its outcome to a status code, send it, log it. */
    private void execute(HttpServerExchange ex, String method, Call call) {
        long start = System.nanoTime();
        int status;
        long serviceMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Reply reply = call.run();
            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
            status = reply.status();
            send(ex, status, reply.body());
        } catch (GraphException rejected) {
            status = statusFor(rejected);
            error = rejected;
            send(ex, status, errorBody(rejected.code().name(), rejected.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (MissingIdentityException anon) {
            status = 401;
            error = anon;
            send(ex, status, errorBody(anon.getMessage(), null));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, errorBody(bad.getMessage(), null));
        } catch (NoSuchElementException missing) {
            status = 404;
            error = missing;
            send(ex, status, errorBody(missing.getMessage(), null));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e.getClass().getSimpleName(), e.getMessage()));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, ex.getRequestPath(), status, totalMs, serviceMs, error);
    }

    static int statusFor(GraphException e) {
        return switch (e.code()) {
            case ALREADY_REGISTERED, CLOCK_REGRESSION -> 409;
            case NOT_OWNER, CAPABILITY_MISMATCH -> 403;
            case UPDATE_TOO_SOON -> 429;
        };
    }

    // ---------- helpers ----------

    private static Identity caller(HttpServerExchange ex) {
        String raw = ex.getRequestHeaders().getFirst(IDENTITY_HEADER);
        if (raw == null || raw.isBlank()) {
            throw new MissingIdentityException();
        }
        return new Identity(raw.trim());
    }

    /** The capability as presented by this caller; the service checks it against the minted one. */
    private static DevCapability presented(String capabilityId, Identity caller) {
        if (capabilityId == null || capabilityId.isBlank()) {
            throw new IllegalArgumentException("capabilityId is required");
        }
        return new DevCapability(capabilityId, caller);
    }

    private static List<PeerRef> peers(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        List<PeerRef> out = new ArrayList<>(raw.size());
        for (String s : raw) {
            if (s == null) throw new IllegalArgumentException("neighbors must not contain null");
            out.add(new PeerRef(s));
        }
        return out;
    }

    private static List<String> segments(String path) {
        return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static UserResponse toUser(UserRecord rec) {
        UserRecord.Pointer p = rec.pointer(); // one read: head and contents stay consistent
        var dto = new UserResponse();
        dto.userId = rec.id();
        dto.owner = rec.owner().value();
        dto.synthetic = rec.synthetic();
        dto.head = p.head().value();
        dto.neighbors = p.current().neighbors().stream().map(PeerRef::value).toList();
        dto.timestampMillis = p.current().timestampMillis();
        return dto;
    }

    private static SnapshotResponse toSnapshot(NodeSnapshot s) {
        var dto = new SnapshotResponse();
        dto.id = s.id().value();
        dto.owner = s.owner().value();
        dto.neighbors = s.neighbors().stream().map(PeerRef::value).toList();
        dto.timestampMillis = s.timestampMillis();
        dto.previous = s.previous().map(SnapshotId::value).orElse(null);
        return dto;
    }

    private static Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null) {
            body.put("message", message);
        }
        return body;
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
