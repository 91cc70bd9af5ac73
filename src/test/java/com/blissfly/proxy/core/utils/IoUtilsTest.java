package com.blissfly.proxy.core.utils;

import com.blissfly.proxy.core.exceptions.ProtocolException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IoUtilsTest {

    @Test
    void readLine_stripsLineEndings() throws IOException {
        InputStream in = stream("GET / HTTP/1.1\r\nHost: a\n\r\n");

        assertThat(IoUtils.readLine(in)).isEqualTo("GET / HTTP/1.1");
        assertThat(IoUtils.readLine(in)).isEqualTo("Host: a");
        assertThat(IoUtils.readLine(in)).isEmpty();
        assertThat(IoUtils.readLine(in)).isNull();
    }

    @Test
    void readLine_enforcesMaximumLength() {
        assertThatThrownBy(() -> IoUtils.readLine(stream("x".repeat(20) + "\r\n"), 10))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void readHeaders_isCaseInsensitive() throws IOException {
        Map<String, String> headers = IoUtils.readHeaders(stream("Content-Type: text/html\r\nX-Odd:  spaced \r\nbroken\r\n\r\nbody"));

        assertThat(headers.get("content-type")).isEqualTo("text/html");
        assertThat(headers.get("X-ODD")).isEqualTo("spaced");
        assertThat(headers).hasSize(2);
    }

    @Test
    void readHeaders_limitsHeaderCount() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= IoUtils.MAX_HEADERS; i++) {
            sb.append("X-H").append(i).append(": v\r\n");
        }
        sb.append("\r\n");

        assertThatThrownBy(() -> IoUtils.readHeaders(stream(sb.toString())))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Too many");
    }

    @Test
    void writeHead_writesStatusLineAndHeaders() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Upgrade", "websocket");
        headers.put("Connection", "Upgrade");

        IoUtils.writeHead(out, "HTTP/1.1 101 Switching Protocols", headers);

        assertThat(out.toString(StandardCharsets.ISO_8859_1))
                .isEqualTo("HTTP/1.1 101 Switching Protocols\r\nUpgrade: websocket\r\nConnection: Upgrade\r\n\r\n");
    }

    @Test
    void relay_copiesBothDirectionsAndCounts() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Counter sent = registry.counter("sent");
        Counter received = registry.counter("received");
        ByteArrayOutputStream toUpstream = new ByteArrayOutputStream();
        ByteArrayOutputStream toClient = new ByteArrayOutputStream();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            IoUtils.relay(stream("client->upstream"), toClient, stream("up"), toUpstream, executor, sent, received);
        } finally {
            executor.shutdownNow();
        }

        assertThat(toUpstream.toString(StandardCharsets.UTF_8)).isEqualTo("client->upstream");
        assertThat(toClient.toString(StandardCharsets.UTF_8)).isEqualTo("up");
        assertThat(sent.count()).isEqualTo(16.0);
        assertThat(received.count()).isEqualTo(2.0);
    }

    @Test
    void closeQuietly_swallowsCloseFailures() {
        assertThatCode(() -> IoUtils.closeQuietly(() -> {
            throw new IOException("already closed");
        })).doesNotThrowAnyException();
        assertThatCode(() -> IoUtils.closeQuietly(null)).doesNotThrowAnyException();
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1));
    }
}
