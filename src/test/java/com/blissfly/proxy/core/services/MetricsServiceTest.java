package com.blissfly.proxy.core.services;

import com.blissfly.proxy.config.BlissflyProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private MetricsService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void adminServer_servesHealthAndMetrics() throws Exception {
        BlissflyProperties props = new BlissflyProperties();
        props.getAdmin().setEnabled(true);
        props.getAdmin().setPort(0);
        service = new MetricsService(props);
        service.setHealthDetails(() -> Map.of("sessions", 3));
        service.getRegistry().counter("test.counter").increment();

        int port = service.getAdminPort();
        assertThat(port).isPositive();

        HttpClient client = HttpClient.newHttpClient();
        HttpResponse<String> health = client.send(HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + "/health")).build(), HttpResponse.BodyHandlers.ofString());
        assertThat(health.statusCode()).isEqualTo(200);
        JsonNode json = new ObjectMapper().readTree(health.body());
        assertThat(json.get("status").asText()).isEqualTo("UP");
        assertThat(json.get("sessions").asInt()).isEqualTo(3);
        assertThat(json.has("uptime")).isTrue();

        HttpResponse<String> metrics = client.send(HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + "/metrics")).build(), HttpResponse.BodyHandlers.ofString());
        assertThat(metrics.statusCode()).isEqualTo(200);
        assertThat(metrics.body()).contains("test_counter_total 1.0");
    }

    @Test
    void disabledAdmin_hasNoPort() {
        BlissflyProperties props = new BlissflyProperties();
        props.getAdmin().setEnabled(false);
        service = new MetricsService(props);

        assertThat(service.getAdminPort()).isEqualTo(-1);
        assertThat(service.getRegistry()).isNotNull();
    }
}
