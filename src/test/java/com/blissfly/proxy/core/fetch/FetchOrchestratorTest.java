package com.blissfly.proxy.core.fetch;

import com.blissfly.proxy.config.CacheConfig;
import com.blissfly.proxy.config.FetchConfig;
import com.blissfly.proxy.core.cache.ResponseCache;
import com.blissfly.proxy.core.exceptions.CircularRedirectException;
import com.blissfly.proxy.core.exceptions.InvalidTokenException;
import com.blissfly.proxy.core.exceptions.TooManyRedirectsException;
import com.blissfly.proxy.core.exceptions.UpstreamUnreachableException;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchOrchestratorTest {

    private WireMockServer wireMock;
    private String base;
    private FetchConfig fetchConfig;
    private ResponseCache cache;
    private FetchOrchestrator orchestrator;
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(wireMockConfig().dynamicPort().gzipDisabled(true));
        wireMock.start();
        base = "http://localhost:" + wireMock.port();

        fetchConfig = new FetchConfig();
        fetchConfig.setTimeout(5_000);
        fetchConfig.setRetryBaseDelay(10);
        CacheConfig cacheConfig = new CacheConfig();
        cacheConfig.setSweepInterval(0);
        cache = new ResponseCache(cacheConfig);
        orchestrator = newOrchestrator();
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
        cache.close();
        wireMock.stop();
    }

    @Test
    void fetch_returnsBodyAndMetadata() {
        wireMock.stubFor(get(urlEqualTo("/page")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/html; charset=utf-8")
                .withHeader("ETag", "\"v1\"")
                .withBody("<p>hi</p>")));

        FetchResult result = orchestrator.fetch(base + "/page");

        assertThat(result.status()).isEqualTo(200);
        assertThat(result.contentType()).isEqualTo("text/html; charset=utf-8");
        assertThat(new String(result.body(), StandardCharsets.UTF_8)).isEqualTo("<p>hi</p>");
        assertThat(result.finalUrl()).isEqualTo(base + "/page");
        assertThat(result.redirectChain()).containsExactly(base + "/page");
        assertThat(result.headers()).containsEntry("etag", "\"v1\"");
        assertThat(result.fromCache()).isFalse();
    }

    @Test
    void fetch_sendsBrowserHeaders() {
        wireMock.stubFor(get(urlEqualTo("/h")).willReturn(aResponse().withStatus(200).withBody("ok")));

        orchestrator.fetch(base + "/h");

        wireMock.verify(getRequestedFor(urlEqualTo("/h"))
                .withHeader("User-Agent", containing("Chrome"))
                .withHeader("Accept-Language", containing("en-US"))
                .withHeader("Origin", equalTo(base))
                .withHeader("Referer", equalTo(base + "/")));
    }

    @Test
    void fetch_appliesConfiguredHeaderOverrides() {
        fetchConfig.getHeaders().put("Accept-Language", "de-DE");
        orchestrator.close();
        orchestrator = newOrchestrator();
        wireMock.stubFor(get(urlEqualTo("/lang")).willReturn(aResponse().withStatus(200).withBody("ok")));

        orchestrator.fetch(base + "/lang");

        wireMock.verify(getRequestedFor(urlEqualTo("/lang")).withHeader("Accept-Language", equalTo("de-DE")));
    }

    @Test
    void fetch_followsRedirectsAndReportsFinalUrl() {
        wireMock.stubFor(get(urlEqualTo("/start")).willReturn(aResponse()
                .withStatus(301).withHeader("Location", base + "/middle")));
        wireMock.stubFor(get(urlEqualTo("/middle")).willReturn(aResponse()
                .withStatus(302).withHeader("Location", "final?x=1")));
        wireMock.stubFor(get(urlEqualTo("/final?x=1")).willReturn(aResponse()
                .withStatus(200).withHeader("Content-Type", "text/plain").withBody("done")));

        FetchResult result = orchestrator.fetch(base + "/start");

        assertThat(result.finalUrl()).isEqualTo(base + "/final?x=1");
        assertThat(result.redirectChain())
                .containsExactly(base + "/start", base + "/middle", base + "/final?x=1");
        assertThat(new String(result.body(), StandardCharsets.UTF_8)).isEqualTo("done");
    }

    @Test
    void fetch_seeOtherSwitchesToGet() {
        wireMock.stubFor(post(urlEqualTo("/form")).willReturn(aResponse()
                .withStatus(303).withHeader("Location", "/thanks")));
        wireMock.stubFor(get(urlEqualTo("/thanks")).willReturn(aResponse().withStatus(200).withBody("thanks")));

        FetchResult result = orchestrator.fetch(orchestrator.request(base + "/form")
                .method("POST")
                .body("a=1".getBytes(StandardCharsets.UTF_8))
                .build());

        assertThat(result.status()).isEqualTo(200);
        wireMock.verify(getRequestedFor(urlEqualTo("/thanks")));
    }

    @Test
    void fetch_detectsCircularRedirects() {
        wireMock.stubFor(get(urlEqualTo("/a")).willReturn(aResponse().withStatus(302).withHeader("Location", "/b")));
        wireMock.stubFor(get(urlEqualTo("/b")).willReturn(aResponse().withStatus(302).withHeader("Location", "/a")));

        assertThatThrownBy(() -> orchestrator.fetch(base + "/a"))
                .isInstanceOf(CircularRedirectException.class);
    }

    @Test
    void fetch_enforcesRedirectLimit() {
        for (int i = 0; i < 5; i++) {
            wireMock.stubFor(get(urlEqualTo("/r" + i)).willReturn(aResponse()
                    .withStatus(302).withHeader("Location", "/r" + (i + 1))));
        }

        assertThatThrownBy(() -> orchestrator.fetch(orchestrator.request(base + "/r0").maxRedirects(2).build()))
                .isInstanceOf(TooManyRedirectsException.class);
        wireMock.verify(1, getRequestedFor(urlEqualTo("/r2")));
        wireMock.verify(0, getRequestedFor(urlEqualTo("/r3")));
    }

    @Test
    void fetch_decodesGzipBodies() throws IOException {
        wireMock.stubFor(get(urlEqualTo("/gz")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/plain")
                .withHeader("Content-Encoding", "gzip")
                .withBody(gzip("compressed text"))));

        FetchResult result = orchestrator.fetch(base + "/gz");

        assertThat(new String(result.body(), StandardCharsets.UTF_8)).isEqualTo("compressed text");
        assertThat(result.headers()).doesNotContainKey("Content-Encoding");
    }

    @Test
    void fetch_servesRepeatedGetsFromCache() {
        wireMock.stubFor(get(urlEqualTo("/cached")).willReturn(aResponse()
                .withStatus(200).withHeader("Content-Type", "text/plain").withBody("once")));

        FetchResult first = orchestrator.fetch(base + "/cached");
        FetchResult second = orchestrator.fetch(base + "/cached");

        assertThat(first.fromCache()).isFalse();
        assertThat(second.fromCache()).isTrue();
        assertThat(new String(second.body(), StandardCharsets.UTF_8)).isEqualTo("once");
        wireMock.verify(1, getRequestedFor(urlEqualTo("/cached")));
    }

    @Test
    void fetch_doesNotCacheErrorResponses() {
        wireMock.stubFor(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404).withBody("nope")));

        assertThat(orchestrator.fetch(base + "/missing").status()).isEqualTo(404);
        assertThat(orchestrator.fetch(base + "/missing").fromCache()).isFalse();
        wireMock.verify(2, getRequestedFor(urlEqualTo("/missing")));
    }

    @Test
    void fetch_bypassesCacheWhenDisabledPerRequest() {
        wireMock.stubFor(get(urlEqualTo("/fresh")).willReturn(aResponse().withStatus(200).withBody("x")));

        orchestrator.fetch(base + "/fresh");
        orchestrator.fetch(orchestrator.request(base + "/fresh").useCache(false).build());

        wireMock.verify(2, getRequestedFor(urlEqualTo("/fresh")));
    }

    @Test
    void fetch_unreachableHostFailsAfterRetries() throws IOException {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }

        assertThatThrownBy(() -> orchestrator.fetch("http://localhost:" + closedPort + "/"))
                .isInstanceOf(UpstreamUnreachableException.class)
                .hasMessageContaining("after 3 attempts");
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void fetch_rejectsNonHttpTargets() {
        assertThatThrownBy(() -> orchestrator.fetch("file:///etc/passwd"))
                .isInstanceOf(InvalidTokenException.class);
    }

    private FetchOrchestrator newOrchestrator() {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        return new FetchOrchestrator(fetchConfig, cache, client, sleeps::add);
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(bos)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return bos.toByteArray();
    }
}
