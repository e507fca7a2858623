package com.ipcsentinel.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StatsServer} over a real loopback socket.
 */
class StatsServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private StatsServer server;

    @BeforeEach
    void setUp() {
        server = new StatsServer(() -> Map.of("registeredHandlerCount", 3));
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should answer /health with status UP")
    void shouldServeHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");
    }

    @Test
    @DisplayName("Should serialize the supplied snapshot on /stats")
    void shouldServeStats() throws Exception {
        HttpResponse<String> response = get("/stats");

        JsonNode json = new ObjectMapper().readTree(response.body());
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json.get("registeredHandlerCount").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should answer 405 to non-GET requests")
    void shouldRejectPost() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/health"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should report its bound port and stop cleanly")
    void shouldTrackLifecycle() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();

        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThat(server.getPort()).isEqualTo(-1);
    }

    @Test
    @DisplayName("Should reject out-of-range ports and a second start")
    void shouldValidateStart() {
        StatsServer other = new StatsServer(Map::of);

        assertThatThrownBy(() -> other.start(70_000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> server.start(0)).isInstanceOf(IllegalStateException.class);
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }
}
