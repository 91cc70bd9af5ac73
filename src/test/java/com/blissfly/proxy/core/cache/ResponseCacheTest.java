package com.blissfly.proxy.core.cache;

import com.blissfly.proxy.config.CacheConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheTest {

    private MutableClock clock;
    private CacheConfig config;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        config = new CacheConfig();
        config.setMaxSize(10);
        config.setMaxMemory(1024 * 1024);
        config.setTtl(60_000);
        config.setSweepInterval(0);
        cache = new ResponseCache(config, clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void getAfterSet_returnsStoredResponse() {
        cache.set("https://example.com/", response("hello"));

        assertThat(cache.get("https://example.com/"))
                .hasValueSatisfying(r -> assertThat(new String(r.body(), StandardCharsets.UTF_8)).isEqualTo("hello"));
        assertThat(cache.getStats().hits()).isEqualTo(1);
    }

    @Test
    void get_normalizesKeys() {
        cache.set("HTTPS://Example.COM:443", response("x"));

        assertThat(cache.get("https://example.com/")).isPresent();
        assertThat(cache.get("https://example.com/#section")).isPresent();
    }

    @Test
    void get_missingKeyCountsAsMiss() {
        assertThat(cache.get("https://example.com/none")).isEmpty();

        CacheStats stats = cache.getStats();
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.totalRequests()).isEqualTo(1);
        assertThat(stats.hitRate()).isZero();
    }

    @Test
    void get_expiredEntryIsRemoved() {
        cache.set("https://example.com/", response("old"), Duration.ofSeconds(1));

        clock.advance(Duration.ofMillis(1001));

        assertThat(cache.get("https://example.com/")).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(cache.memoryBytes()).isZero();
        assertThat(cache.getStats().evictions()).isEqualTo(1);
    }

    @Test
    void set_evictsLeastRecentlyAccessedWhenFull() {
        for (int i = 0; i < 10; i++) {
            cache.set("https://example.com/" + i, response("v" + i));
        }
        cache.get("https://example.com/0");

        cache.set("https://example.com/10", response("v10"));

        assertThat(cache.size()).isEqualTo(10);
        assertThat(cache.get("https://example.com/0")).isPresent();
        assertThat(cache.get("https://example.com/1")).isEmpty();
        assertThat(cache.get("https://example.com/10")).isPresent();
    }

    @Test
    void set_respectsMemoryBound() {
        config.setMaxMemory(100);
        cache = new ResponseCache(config, clock);

        cache.set("a", new CachedResponse(200, null, Map.of(), new byte[40]));
        cache.set("b", new CachedResponse(200, null, Map.of(), new byte[40]));
        cache.set("c", new CachedResponse(200, null, Map.of(), new byte[40]));

        assertThat(cache.memoryBytes()).isLessThanOrEqualTo(100);
        assertThat(cache.get("c")).isPresent();
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void set_skipsValuesLargerThanTheWholeCache() {
        config.setMaxMemory(10);
        cache = new ResponseCache(config, clock);

        cache.set("big", new CachedResponse(200, null, Map.of(), new byte[64]));

        assertThat(cache.size()).isZero();
    }

    @Test
    void set_replacingKeyKeepsAccountingConsistent() {
        cache.set("k", new CachedResponse(200, null, Map.of(), new byte[10]));
        cache.set("k", new CachedResponse(200, null, Map.of(), new byte[20]));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.memoryBytes()).isEqualTo(21);
    }

    @Test
    void sweep_removesExpiredAndNeverReadEntries() {
        cache.set("https://example.com/read", response("r"));
        cache.set("https://example.com/unread", response("u"));
        cache.set("https://example.com/short", response("s"), Duration.ofMillis(10));
        cache.get("https://example.com/read");
        cache.get("https://example.com/short");

        clock.advance(Duration.ofMillis(50));

        assertThat(cache.sweep()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("https://example.com/read")).isPresent();
    }

    @Test
    void estimatedSizing_usesFixedSizeForBinaryBodies() {
        config.setSizingMode("estimated");
        cache = new ResponseCache(config, clock);

        cache.set("img", new CachedResponse(200, "image/png", Map.of(), new byte[5]));
        cache.set("page", new CachedResponse(200, "text/html", Map.of(), new byte[7]));

        assertThat(cache.memoryBytes()).isEqualTo(SizingMode.NON_TEXT_ESTIMATE + 7);
    }

    @Test
    void sizingMode_rejectsUnknownValues() {
        config.setSizingMode("fuzzy");
        assertThatThrownBy(() -> new ResponseCache(config, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_dropsEntriesButKeepsCounters() {
        cache.set("https://example.com/", response("x"));
        cache.get("https://example.com/");

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.memoryBytes()).isZero();
        assertThat(cache.getStats().hits()).isEqualTo(1);
    }

    @Test
    void normalizeKey_canonicalizesUrls() {
        assertThat(ResponseCache.normalizeKey("HTTP://Example.COM:80")).isEqualTo("http://example.com/");
        assertThat(ResponseCache.normalizeKey("https://a.com:443/x/../y?q=1#f")).isEqualTo("https://a.com/y?q=1");
        assertThat(ResponseCache.normalizeKey("http://a.com:8080/p")).isEqualTo("http://a.com:8080/p");
        assertThat(ResponseCache.normalizeKey("plain-key")).isEqualTo("plain-key");
    }

    private static CachedResponse response(String body) {
        return new CachedResponse(200, "text/plain", Map.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
