package com.company.monitoring.client;

import com.company.monitoring.domain.ActiveStage;
import com.company.monitoring.domain.FetchResult;
import com.company.monitoring.domain.StageHeader;
import com.company.monitoring.domain.enums.FetchErrorType;
import com.company.monitoring.exception.TelemetryApiException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestTelemetryClientTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private HttpServer server;
    private SimpleMeterRegistry meterRegistry;
    private RestTelemetryClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", this::handle);
        server.start();

        meterRegistry = new SimpleMeterRegistry();
        client = new RestTelemetryClient(new RestTemplate(), new ObjectMapper(), meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        Response response = responses.getOrDefault(exchange.getRequestURI().getPath(), new Response(404, "not found"));
        if (response.body == null) {
            exchange.sendResponseHeaders(response.status, -1);
            exchange.close();
            return;
        }
        byte[] body = response.body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void respond(String path, int status, String body) {
        responses.put(path, new Response(status, body));
    }

    @Test
    @DisplayName("Latest non-null point of data.data is the value")
    void latestPoint() {
        respond("/stages/datum/100", 200,
                "{\"data\":{\"data\":[[1709287200000,17.5],[1709287260000,18.2],[1709287320000,null]]}}");

        FetchResult result = client.fetchValue("100");

        assertThat(result.isError()).isFalse();
        assertThat(result.getValue()).isEqualTo(18.2);
        assertThat(result.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1709287260000L));
        assertThat(result.getTotalPoints()).isEqualTo(3);
    }

    @Test
    @DisplayName("datum.value strings are parsed as numbers")
    void datumValue() {
        respond("/stages/datum/101", 200, "{\"datum\":{\"value\":\"42.5\",\"timestamp\":\"2024-03-01T09:59:00Z\"}}");

        FetchResult result = client.fetchValue("101");

        assertThat(result.getValue()).isEqualTo(42.5);
        assertThat(result.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T09:59:00Z"));
    }

    @Test
    @DisplayName("Empty point arrays and 204 responses are NO_CONTENT")
    void noContent() {
        respond("/stages/datum/102", 200, "{\"data\":{\"data\":[]}}");
        respond("/stages/datum/103", 204, null);

        assertThat(client.fetchValue("102").getErrorType()).isEqualTo(FetchErrorType.NO_CONTENT);
        assertThat(client.fetchValue("103").getErrorType()).isEqualTo(FetchErrorType.NO_CONTENT);
    }

    @Test
    @DisplayName("Non-2xx status is an HTTP_STATUS failure carrying the body")
    void httpStatus() {
        respond("/stages/datum/104", 500, "{\"error\":\"boom\"}");

        FetchResult result = client.fetchValue("104");

        assertThat(result.getErrorType()).isEqualTo(FetchErrorType.HTTP_STATUS);
        assertThat(result.getError()).startsWith("API error 500");
        assertThat(meterRegistry.counter("monitoring.fetch.errors", "type", "HTTP_STATUS").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Unparseable or shapeless bodies are MALFORMED_PAYLOAD")
    void malformed() {
        respond("/stages/datum/105", 200, "not json");
        respond("/stages/datum/106", 200, "{\"status\":\"ok\"}");

        assertThat(client.fetchValue("105").getErrorType()).isEqualTo(FetchErrorType.MALFORMED_PAYLOAD);
        assertThat(client.fetchValue("106").getErrorType()).isEqualTo(FetchErrorType.MALFORMED_PAYLOAD);
    }

    @Test
    @DisplayName("Connection refused is a NETWORK failure and a failed ping")
    void networkFailure() {
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:1");

        assertThat(client.fetchValue("107").getErrorType()).isEqualTo(FetchErrorType.NETWORK);
        assertThat(client.ping()).isFalse();
    }

    @Test
    @DisplayName("Active stages and stage headers are read from their listings")
    void stagesAndHeaders() {
        respond("/stages/active/stages", 200,
                "{\"stages\":[{\"projectId\":\"p-1\",\"projectName\":\"Pad A\",\"companyId\":\"c-1\","
                        + "\"companyName\":\"Acme\",\"stageId\":\"s-2\",\"stageName\":\"Stage 2\"}]}");
        respond("/stages/s-2/headers", 200, "{\"headers\":[{\"id\":200,\"name\":\"Casing Pressure\"}]}");

        List<ActiveStage> stages = client.fetchActiveStages();
        List<StageHeader> headers = client.fetchStageHeaders("s-2");

        assertThat(stages).singleElement().satisfies(stage -> {
            assertThat(stage.getProjectId()).isEqualTo("p-1");
            assertThat(stage.getStageId()).isEqualTo("s-2");
        });
        assertThat(headers).containsExactly(new StageHeader("200", "Casing Pressure"));
        assertThat(client.ping()).isTrue();
    }

    @Test
    @DisplayName("Listing failures raise TelemetryApiException")
    void listingFailure() {
        respond("/stages/s-3/headers", 503, "{}");

        assertThatThrownBy(() -> client.fetchStageHeaders("s-3"))
                .isInstanceOf(TelemetryApiException.class)
                .hasMessageContaining("503");
    }

    private static final class Response {
        private final int status;
        private final String body;

        Response(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
