package com.faultline.triage.cache;

import com.faultline.triage.config.TriageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineResultCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineResultCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineResultCache(new TriageProperties(), nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    void entriesExpireAfterTheirOwnTtl() {
        cache.set("incident_data:INC-1", "collection", Duration.ofMinutes(10));
        cache.set("incident_analysis:INC-1", "analysis", Duration.ofMinutes(30));

        advance(Duration.ofMinutes(11));

        assertThat(cache.<String>get("incident_data:INC-1")).isEmpty();
        assertThat(cache.<String>get("incident_analysis:INC-1")).contains("analysis");
    }

    @Test
    void readsDoNotExtendTtl() {
        cache.set("k", 42, Duration.ofMinutes(5));
        advance(Duration.ofMinutes(4));
        assertThat(cache.<Integer>get("k")).contains(42);

        advance(Duration.ofMinutes(2));
        assertThat(cache.<Integer>get("k")).isEmpty();
    }

    @Test
    void overwriteResetsTtl() {
        cache.set("k", "first", Duration.ofMinutes(5));
        advance(Duration.ofMinutes(4));
        cache.set("k", "second", Duration.ofMinutes(5));
        advance(Duration.ofMinutes(4));

        assertThat(cache.<String>get("k")).contains("second");
    }

    @Test
    void deleteReportsWhetherEntryExisted() {
        cache.set("k", "v", Duration.ofMinutes(1));

        assertThat(cache.delete("k")).isTrue();
        assertThat(cache.delete("k")).isFalse();
        assertThat(cache.size()).isZero();
    }

    @Test
    void settingNullRemovesEntry() {
        cache.set("k", "v", Duration.ofMinutes(1));
        cache.set("k", null, Duration.ofMinutes(1));

        assertThat(cache.<String>get("k")).isEmpty();
    }

    @Test
    void keysMatchGlobPatterns() {
        cache.set("incident_data:INC-1", 1, Duration.ofMinutes(1));
        cache.set("incident_data:INC-2", 2, Duration.ofMinutes(1));
        cache.set("fault_patterns:INC-1", 3, Duration.ofMinutes(1));
        cache.set("incident_data:INC-10", 4, Duration.ofMinutes(1));

        assertThat(cache.keys("incident_data:*"))
                .containsExactly("incident_data:INC-1", "incident_data:INC-10", "incident_data:INC-2");
        assertThat(cache.keys("incident_data:INC-?")).hasSize(2);
        assertThat(cache.keys("*:INC-1")).hasSize(2);
    }

    @Test
    void globEscapesRegexMetacharacters() {
        assertThat(CaffeineResultCache.globToRegex("a.b*").matcher("a.bcd").matches()).isTrue();
        assertThat(CaffeineResultCache.globToRegex("a.b*").matcher("axbcd").matches()).isFalse();
    }
}
