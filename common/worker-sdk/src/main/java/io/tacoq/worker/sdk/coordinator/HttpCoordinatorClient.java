package io.tacoq.worker.sdk.coordinator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.tacoq.worker.sdk.api.CoordinatorHealth;
import io.tacoq.worker.sdk.api.TaskOutcome;
import io.tacoq.worker.sdk.api.TaskRecord;
import io.tacoq.worker.sdk.api.TaskResult;
import io.tacoq.worker.sdk.api.TaskStatus;
import io.tacoq.worker.sdk.api.WorkerIdentity;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CoordinatorClient} speaking the coordinator's JSON/HTTP API.
 */
public final class HttpCoordinatorClient implements CoordinatorClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCoordinatorClient.class);
    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String WORKERS_PATH = "/workers";
    private static final String TASKS_PATH = "/tasks";

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpCoordinatorClient(String baseUrl) {
        this(baseUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, new ObjectMapper());
    }

    public HttpCoordinatorClient(String baseUrl, Duration connectTimeout, Duration requestTimeout, ObjectMapper json) {
        this.baseUrl = requireBaseUrl(baseUrl);
        this.json = Objects.requireNonNull(json, "json");
        this.http = HttpClient.newBuilder()
            .connectTimeout(resolveTimeout(connectTimeout, DEFAULT_CONNECT_TIMEOUT))
            .build();
        this.requestTimeout = resolveTimeout(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
    }

    @Override
    public WorkerIdentity registerWorker(String name, List<String> taskKinds) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(taskKinds, "taskKinds");
        String body = write(Map.of("name", name, "task_kinds", List.copyOf(taskKinds)));
        HttpResponse<String> response = send(request(WORKERS_PATH).POST(HttpRequest.BodyPublishers.ofString(body)),
            "register worker " + name);
        JsonNode id = read(response, "register worker " + name).path("id");
        if (!id.isTextual() || id.asText().isBlank()) {
            throw new CoordinatorException("register worker " + name + " response carries no id", response.statusCode());
        }
        return new WorkerIdentity(id.asText());
    }

    @Override
    public void unregisterWorker(WorkerIdentity worker) {
        Objects.requireNonNull(worker, "worker");
        send(request(WORKERS_PATH + "/" + encode(worker.id())).DELETE(), "unregister worker " + worker.id());
    }

    @Override
    public void reportStatus(String taskId, TaskStatus status) {
        Objects.requireNonNull(status, "status");
        String body = write(status.wireValue());
        send(request(taskPath(taskId) + "/status").PUT(HttpRequest.BodyPublishers.ofString(body)),
            "status of task " + taskId);
    }

    @Override
    public void reportResult(String taskId, TaskOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        ObjectNode body = json.createObjectNode();
        if (outcome instanceof TaskOutcome.Success success) {
            body.set("data", success.output());
        } else if (outcome instanceof TaskOutcome.Failure failure) {
            body.set("data", TextNode.valueOf(failure.description()));
        }
        body.put("is_error", outcome.isError());
        send(request(taskPath(taskId) + "/result").PUT(HttpRequest.BodyPublishers.ofString(write(body))),
            "result of task " + taskId);
    }

    @Override
    public TaskRecord getTask(String taskId) {
        String label = "task " + taskId;
        HttpResponse<String> response = send(request(taskPath(taskId)).GET(), label);
        JsonNode node = read(response, label);
        try {
            return toTaskRecord(node);
        } catch (RuntimeException ex) {
            throw new CoordinatorException(label + " response is malformed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public CoordinatorHealth checkHealth() {
        HttpRequest request = request("/health").GET().build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200 ? CoordinatorHealth.HEALTHY : CoordinatorHealth.UNHEALTHY;
        } catch (IOException ex) {
            log.debug("Coordinator {} not reachable: {}", baseUrl, ex.getMessage());
            return CoordinatorHealth.NOT_REACHABLE;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return CoordinatorHealth.NOT_REACHABLE;
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .timeout(requestTimeout);
    }

    private HttpResponse<String> send(HttpRequest.Builder builder, String label) {
        HttpRequest request = builder.build();
        log.debug("{} {} ({})", request.method(), request.uri(), label);
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new CoordinatorConnectionException(label + " failed: coordinator " + baseUrl + " not reachable", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CoordinatorConnectionException(label + " interrupted", ex);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CoordinatorException(label + " returned status " + status + bodySuffix(response.body()), status);
        }
        return response;
    }

    private JsonNode read(HttpResponse<String> response, String label) {
        try {
            return json.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException ex) {
            throw new CoordinatorException(label + " response is not valid JSON", ex);
        }
    }

    private String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new CoordinatorException("Unable to serialise coordinator request", ex);
        }
    }

    TaskRecord toTaskRecord(JsonNode node) {
        JsonNode kind = node.path("task_kind");
        String kindName = kind.isObject() ? kind.path("name").asText(null) : kind.asText(null);
        JsonNode assigned = node.path("assigned_to");
        JsonNode result = node.path("result");
        return new TaskRecord(
            requireField(node, "id"),
            Objects.requireNonNull(kindName, "task_kind"),
            node.get("input_data"),
            TaskStatus.fromWire(requireField(node, "status")),
            parseTimestamp(node.path("created_at").asText(null)),
            assigned.isTextual() && !assigned.asText().isBlank() ? assigned.asText() : null,
            result.isObject() ? toTaskResult(result) : null);
    }

    private static TaskResult toTaskResult(JsonNode node) {
        Instant createdAt = parseTimestamp(node.path("created_at").asText(null));
        if (node.has("is_error")) {
            return new TaskResult(node.get("data"), node.path("is_error").asBoolean(), createdAt);
        }
        JsonNode output = node.get("output_data");
        boolean isError = output == null || output.isNull();
        return new TaskResult(isError ? node.get("error_data") : output, isError, createdAt);
    }

    // the coordinator serialises naive timestamps (no offset) as UTC
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ex) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }

    private static String requireField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value.asText();
    }

    private static String taskPath(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be null or blank");
        }
        return TASKS_PATH + "/" + encode(taskId);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String bodySuffix(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        return body.length() > 200 ? ": " + body.substring(0, 200) + "..." : ": " + body;
    }

    private static Duration resolveTimeout(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isZero() || candidate.isNegative()) {
            return fallback;
        }
        return candidate;
    }

    private static String requireBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("coordinator url must not be null or blank");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        URI uri = URI.create(trimmed);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("coordinator url must be an absolute http(s) URL: " + baseUrl);
        }
        return trimmed;
    }
}
