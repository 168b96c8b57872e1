package com.company.monitoring.client;

import com.company.monitoring.domain.ActiveStage;
import com.company.monitoring.domain.FetchResult;
import com.company.monitoring.domain.StageHeader;
import com.company.monitoring.domain.enums.FetchErrorType;
import com.company.monitoring.exception.TelemetryApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

@Component
@Slf4j
public class RestTelemetryClient implements TelemetryClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${monitoring.telemetry.base-url}")
    private String baseUrl;

    public RestTelemetryClient(@Qualifier("telemetryRestTemplate") RestTemplate restTemplate,
                               ObjectMapper objectMapper,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public FetchResult fetchValue(String headerId) {
        Instant now = clock.instant();
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(baseUrl + "/stages/datum/{headerId}", String.class, headerId);
        } catch (HttpStatusCodeException e) {
            return failure(headerId, FetchErrorType.HTTP_STATUS,
                    "API error " + e.getStatusCode().value() + bodySuffix(e.getResponseBodyAsString()), now);
        } catch (ResourceAccessException e) {
            FetchErrorType type = e.getCause() instanceof SocketTimeoutException
                    ? FetchErrorType.TIMEOUT
                    : FetchErrorType.NETWORK;
            return failure(headerId, type, e.getMessage(), now);
        } catch (RestClientException e) {
            return failure(headerId, FetchErrorType.NETWORK, e.getMessage(), now);
        }

        String body = response.getBody();
        if (response.getStatusCode() == HttpStatus.NO_CONTENT || body == null || body.isBlank()) {
            return failure(headerId, FetchErrorType.NO_CONTENT, "Empty response body", now);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return failure(headerId, FetchErrorType.MALFORMED_PAYLOAD, "Response is not valid JSON", now);
        }
        return parseDatum(headerId, root, now);
    }

    /**
     * Accepts {@code datum.value}, a {@code data.data} array of points, or a top-level {@code value}.
     * Points may be {@code [timestamp, value]} pairs, {@code {timestamp, value}} objects or bare values.
     */
    FetchResult parseDatum(String headerId, JsonNode root, Instant now) {
        if (root == null || !root.isObject()) {
            return failure(headerId, FetchErrorType.MALFORMED_PAYLOAD, "Response is not a JSON object", now);
        }

        JsonNode datum = root.path("datum");
        if (datum.has("value")) {
            return FetchResult.success(headerId, toValue(datum.get("value")),
                    parseTimestamp(datum.get("timestamp"), now), 1);
        }

        JsonNode points = root.path("data").path("data");
        if (points.isArray()) {
            if (points.isEmpty()) {
                return failure(headerId, FetchErrorType.NO_CONTENT, "No data points", now);
            }
            JsonNode fallbackTimestamp = root.path("data").has("endTimestamp")
                    ? root.path("data").get("endTimestamp")
                    : root.path("data").get("startTimestamp");

            for (int i = points.size() - 1; i >= 0; i--) {
                JsonNode point = points.get(i);
                JsonNode valueNode;
                JsonNode timestampNode;
                if (point.isArray() && point.size() >= 2) {
                    timestampNode = point.get(0);
                    valueNode = point.get(1);
                } else if (point.isObject()) {
                    timestampNode = point.get("timestamp");
                    valueNode = point.get("value");
                } else {
                    timestampNode = null;
                    valueNode = point;
                }
                if (valueNode == null || valueNode.isNull()) {
                    continue;
                }
                Instant timestamp = parseTimestamp(timestampNode != null ? timestampNode : fallbackTimestamp, now);
                return FetchResult.success(headerId, toValue(valueNode), timestamp, points.size());
            }
            return failure(headerId, FetchErrorType.NO_CONTENT, "All data points are null", now);
        }

        if (root.has("value")) {
            return FetchResult.success(headerId, toValue(root.get("value")),
                    parseTimestamp(root.get("timestamp"), now), 1);
        }

        return failure(headerId, FetchErrorType.MALFORMED_PAYLOAD, "Response has no data.data array", now);
    }

    @Override
    public List<ActiveStage> fetchActiveStages() {
        JsonNode root = getJson("/stages/active/stages");
        List<ActiveStage> stages = new ArrayList<>();
        for (JsonNode stage : root.path("stages")) {
            stages.add(ActiveStage.builder()
                    .projectId(text(stage, "projectId"))
                    .projectName(text(stage, "projectName"))
                    .companyId(text(stage, "companyId"))
                    .companyName(text(stage, "companyName"))
                    .stageId(text(stage, "stageId"))
                    .stageName(text(stage, "stageName"))
                    .build());
        }
        log.debug("Fetched {} active stages", stages.size());
        return stages;
    }

    @Override
    public List<StageHeader> fetchStageHeaders(String stageId) {
        JsonNode root = getJson("/stages/" + stageId + "/headers");
        List<StageHeader> headers = new ArrayList<>();
        for (JsonNode header : root.path("headers")) {
            headers.add(new StageHeader(text(header, "id"), text(header, "name")));
        }
        log.debug("Fetched {} headers for stage {}", headers.size(), stageId);
        return headers;
    }

    @Override
    public boolean ping() {
        try {
            restTemplate.getForEntity(baseUrl + "/stages/active/stages", String.class);
            return true;
        } catch (RestClientException e) {
            log.warn("Telemetry API check failed: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode getJson(String path) {
        try {
            String body = restTemplate.getForObject(baseUrl + path, String.class);
            if (body == null || body.isBlank()) {
                throw new TelemetryApiException("Empty response from " + path);
            }
            return objectMapper.readTree(body);
        } catch (HttpStatusCodeException e) {
            throw new TelemetryApiException("API error " + e.getStatusCode().value() + " for " + path, e);
        } catch (RestClientException e) {
            throw new TelemetryApiException("Failed to call " + path + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new TelemetryApiException("Malformed response from " + path, e);
        }
    }

    private FetchResult failure(String headerId, FetchErrorType type, String error, Instant now) {
        log.warn("Fetch failed for header {}: {} ({})", headerId, error, type);
        meterRegistry.counter("monitoring.fetch.errors", "type", type.name()).increment();
        return FetchResult.failure(headerId, type, error, now);
    }

    /**
     * Numbers stay numeric, numeric strings are parsed, anything else is kept as text
     */
    static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        String text = node.asText();
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return text;
        }
    }

    static Instant parseTimestamp(JsonNode node, Instant fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String bodySuffix(String body) {
        return body == null || body.isBlank() ? "" : " - " + body;
    }
}
