package io.stagewise.server.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.ExecutionError;
import io.stagewise.core.sandbox.Sandbox;
import io.stagewise.core.sandbox.SandboxException;
import io.stagewise.core.sandbox.SandboxOutput;
import io.stagewise.core.state.ArtifactKind;
import io.stagewise.core.state.Table;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/// {@link Sandbox} backed by a remote code-execution service over HTTP/JSON.
///
/// ### Endpoints
/// | Method | Path | Body | Response |
/// |--------|------|------|----------|
/// | `POST` | `/sessions` | - | `{"session_id": "..."}` |
/// | `GET` | `/sessions/{id}` | - | 200 when alive, 404 otherwise |
/// | `PUT` | `/sessions/{id}/files?path=...` | raw bytes | 2xx |
/// | `POST` | `/sessions/{id}/execute` | `{"code": "..."}` | execution result |
///
/// An execution result looks like:
/// ```json
/// {"stdout": ["..."], "stderr": [],
///  "results": [{"type": "table", "columns": ["a"], "rows": [[1]]},
///              {"type": "image", "png": "<base64>"},
///              {"type": "json", "data": {...}},
///              {"type": "text", "text": "..."}],
///  "error": {"name": "KeyError", "value": "'x'", "traceback": "..."}}
/// ```
///
/// Non-2xx responses raise {@link SandboxException} with the HTTP status, so the retry
/// classifier treats 5xx and 429 as transient.
///
/// @implNote Thread-safe. Blocking I/O; called from node worker threads.
public class HttpSandboxClient implements Sandbox {

    private static final Logger LOG = Logger.getLogger(HttpSandboxClient.class);

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;
    private final Duration executeTimeout;

    /// Creates a client.
    ///
    /// @param baseUrl service root without trailing slash, not null
    /// @param objectMapper Jackson mapper for request and response bodies, not null
    /// @param executeTimeout deadline for a single `runCode` call, not null
    public HttpSandboxClient(String baseUrl, ObjectMapper objectMapper, Duration executeTimeout) {
        this(
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(10))
                        .build(),
                baseUrl,
                objectMapper,
                executeTimeout);
    }

    HttpSandboxClient(HttpClient http, String baseUrl, ObjectMapper objectMapper, Duration executeTimeout) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.executeTimeout = Objects.requireNonNull(executeTimeout, "executeTimeout must not be null");
    }

    @Override
    public String acquireSession() {
        HttpResponse<String> response = send(
                request("/sessions", Duration.ofSeconds(60))
                        .POST(HttpRequest.BodyPublishers.noBody())
                        .build(),
                "acquireSession");
        String handle = readTree(response.body(), "acquireSession").path("session_id").asText("");
        if (handle.isEmpty()) {
            throw new SandboxException("acquireSession returned no session_id");
        }
        LOG.infov("Sandbox session created: {0}", handle);
        return handle;
    }

    @Override
    public boolean isAlive(String handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        HttpRequest request = request("/sessions/" + encode(handle), Duration.ofSeconds(10))
                .GET()
                .build();
        try {
            int status = http.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
            return status >= 200 && status < 300;
        } catch (IOException e) {
            LOG.debugv("Sandbox liveness check failed for {0}: {1}", handle, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while checking sandbox session " + handle, e);
        }
    }

    @Override
    public void writeFile(String handle, String path, byte[] content) {
        Objects.requireNonNull(handle, "handle must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
        LOG.debugv("Writing {0} bytes to {1} in sandbox session {2}", content.length, path, handle);
        send(
                request("/sessions/" + encode(handle) + "/files?path=" + encode(path), Duration.ofSeconds(60))
                        .header("Content-Type", "application/octet-stream")
                        .PUT(HttpRequest.BodyPublishers.ofByteArray(content))
                        .build(),
                "writeFile " + path);
    }

    @Override
    public CodeExecution runCode(String handle, String code) {
        Objects.requireNonNull(handle, "handle must not be null");
        Objects.requireNonNull(code, "code must not be null");
        String body = toJson(Map.of("code", code));
        HttpResponse<String> response = send(
                request("/sessions/" + encode(handle) + "/execute", executeTimeout.plusSeconds(30))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                "runCode");
        return parseExecution(readTree(response.body(), "runCode"));
    }

    /// Converts an execution result document into a {@link CodeExecution}.
    CodeExecution parseExecution(JsonNode root) {
        List<SandboxOutput> outputs = new ArrayList<>();
        for (JsonNode result : root.path("results")) {
            SandboxOutput output = parseOutput(result);
            if (output != null) {
                outputs.add(output);
            }
        }
        ExecutionError error = null;
        JsonNode errorNode = root.path("error");
        if (errorNode.isObject()) {
            error = new ExecutionError(
                    errorNode.path("name").asText(null),
                    errorNode.path("value").asText(null),
                    errorNode.path("traceback").asText(null));
        }
        return new CodeExecution(joinLines(root.path("stdout")), joinLines(root.path("stderr")), outputs, error);
    }

    private SandboxOutput parseOutput(JsonNode result) {
        String type = result.path("type").asText("");
        return switch (type) {
            case "table" -> new SandboxOutput(ArtifactKind.TABLE, parseTable(result));
            case "image" -> new SandboxOutput(
                    ArtifactKind.IMAGE, Base64.getDecoder().decode(result.path("png").asText("")));
            case "json" -> new SandboxOutput(ArtifactKind.JSON, json.convertValue(result.path("data"), Object.class));
            case "text" -> new SandboxOutput(ArtifactKind.TEXT, result.path("text").asText(""));
            default -> {
                LOG.warnv("Ignoring sandbox result of unknown type: {0}", type);
                yield null;
            }
        };
    }

    private Table parseTable(JsonNode result) {
        List<String> columns = new ArrayList<>();
        result.path("columns").forEach(column -> columns.add(column.asText()));
        List<List<Object>> rows = new ArrayList<>();
        for (JsonNode row : result.path("rows")) {
            List<Object> cells = new ArrayList<>();
            row.forEach(cell -> cells.add(json.convertValue(cell, Object.class)));
            rows.add(cells);
        }
        return new Table(columns, rows);
    }

    private static String joinLines(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        StringBuilder sb = new StringBuilder();
        node.forEach(line -> sb.append(line.asText()));
        return sb.toString();
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest request, String opName) {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SandboxException(opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException(opName + " interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new SandboxException(opName + " failed, HTTP " + status + ": " + response.body(), status, null);
        }
        return response;
    }

    private JsonNode readTree(String body, String opName) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SandboxException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SandboxException("JSON serialization failed", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
