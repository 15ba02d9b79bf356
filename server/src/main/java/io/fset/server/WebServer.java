// file: server/src/main/java/io/fset/server/WebServer.java
package io.fset.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fset.core.model.NewProject;
import io.fset.core.model.Project;
import io.fset.server.dto.CreateProjectRequest;
import io.fset.server.dto.DiffResponse;
import io.fset.server.reconcile.DiffResult;
import io.fset.storage.ConflictViolationException;
import io.fset.storage.InvalidValueException;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Thin HTTP adapter over {@link ProjectService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies.
 *  - Convert service results back into JSON.
 *  - Map rejections and exceptions to HTTP status codes.
 *  - Emit basic per-request logging.
 *
 * Path layout:
 *   - POST /projects                   Create a project (body optional)
 *   - GET  /projects/{name}            Wire representation; name is a key or an anchor
 *   - POST /projects/{name}/diff       Apply a diff atomically
 *   - GET  /admin/health               Basic health check
 *
 * Diff status codes:
 *   200 committed, 400 invalid JSON, malformed entry or unstorable value,
 *   404 unknown project, 409 store conflict, 413 body too large,
 *   422 unresolved parent file, 500 other store failure.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ProjectService projects;

    public WebServer(int port, ProjectService projects) {
        this.projects = projects;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/projects".equals(path) || "/projects/".equals(path)) {
                        if ("POST".equals(method)) {
                            handleCreate(exchange);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, -1, null);
                        }
                    } else if (path.startsWith("/projects/") && path.endsWith("/diff")) {
                        String name = path.substring("/projects/".length(), path.length() - "/diff".length());
                        if (name.isBlank() || name.contains("/")) {
                            send(exchange, 400, Map.of("error", "project name must not be empty"));
                            RequestLogger.logRequest(method, path, 400, 0, -1, null);
                        } else if ("POST".equals(method)) {
                            handleDiff(exchange, name);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, -1, null);
                        }
                    } else if (path.startsWith("/projects/")) {
                        String name = path.substring("/projects/".length());
                        if (name.contains("/")) {
                            send(exchange, 404, Map.of("error", "not found"));
                            RequestLogger.logRequest(method, path, 404, 0, -1, null);
                        } else if ("GET".equals(method)) {
                            handleGet(exchange, name);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, -1, null);
                        }
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
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

    // ---------- handlers ----------

    /** GET /projects/{name} */
    private void handleGet(HttpServerExchange ex, String name) {
        long start = System.nanoTime();
        int status = 200;
        long storageMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Optional<Project> project = projects.get(name);
            storageMs = (System.nanoTime() - sStart) / 1_000_000L;

            if (project.isEmpty()) {
                status = 404;
                send(ex, status, Map.of("error", "not found"));
            } else {
                send(ex, status, projects.wire(project.get()));
            }
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, storageMs, error);
        }
    }

    /** POST /projects */
    private void handleCreate(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long storageMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            CreateProjectRequest req = data.length == 0
                                    ? new CreateProjectRequest()
                                    : json.readValue(data, CreateProjectRequest.class);
                            long sStart = System.nanoTime();
                            Project created = projects.create(
                                    new NewProject(req.anchor, req.key, req.order, req.description));
                            storageMs = (System.nanoTime() - sStart) / 1_000_000L;

                            status = 201;
                            send(exchange, status, projects.wire(created));
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (ConflictViolationException conflict) {
                        status = 409;
                        error = conflict;
                        send(exchange, status, Map.of("error", "project already exists"));
                    } catch (InvalidValueException | IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("POST", path, exchange.getStatusCode(), totalMs, storageMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    /** POST /projects/{name}/diff */
    private void handleDiff(HttpServerExchange ex, String name) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long storageMs = -1L;
                    String outcome = null;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            Map<String, Object> diff = json.readValue(data, JSON_OBJECT);
                            if (diff == null) {
                                throw new IllegalArgumentException("diff must be a JSON object");
                            }
                            long sStart = System.nanoTime();
                            Optional<DiffResult> result = projects.persistDiff(name, diff);
                            storageMs = (System.nanoTime() - sStart) / 1_000_000L;

                            if (result.isEmpty()) {
                                status = 404;
                                send(exchange, status, Map.of("error", "not found"));
                            } else {
                                status = statusFor(result.get());
                                if (result.get() instanceof DiffResult.Rejected rejected) {
                                    outcome = rejected.reason().name();
                                }
                                send(exchange, status, toResponse(result.get()));
                            }
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
                        RequestLogger.logRequest("POST", path, exchange.getStatusCode(), outcome, totalMs, storageMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    // ---------- helpers ----------

    static int statusFor(DiffResult result) {
        if (result instanceof DiffResult.Rejected rejected) {
            return switch (rejected.reason()) {
                case MALFORMED_ENTRY -> 400;
                case UNRESOLVED_PARENT -> 422;
                case CONFLICT_VIOLATION -> 409;
                case INVALID_VALUE -> 400;
                case STORE_FAILURE -> 500;
            };
        }
        return 200;
    }

    static DiffResponse toResponse(DiffResult result) {
        DiffResponse dto = new DiffResponse();
        if (result instanceof DiffResult.Committed committed) {
            DiffResult.Summary s = committed.summary();
            dto.ok = true;
            dto.projectUpdated = s.projectUpdated();
            dto.filesChanged = s.filesChanged();
            dto.fmodelsChanged = s.fmodelsChanged();
            dto.fmodelsRemoved = s.fmodelsRemoved();
            dto.filesRemoved = s.filesRemoved();
            dto.filesAdded = s.filesAdded();
            dto.fmodelsAdded = s.fmodelsAdded();
        } else {
            DiffResult.Rejected r = (DiffResult.Rejected) result;
            dto.ok = false;
            dto.reason = r.reason().name();
            dto.error = r.message();
            dto.offendingAnchor = r.offending() == null ? null : r.offending().anchor();
        }
        return dto;
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
