package com.faultline.triage.cache;

import com.faultline.triage.config.TriageProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * In-process result cache backed by Caffeine, with the TTL chosen per entry.
 */
@Slf4j
@Component
public class CaffeineResultCache implements ResultCache {

    private final Cache<String, Entry> cache;

    @Autowired
    public CaffeineResultCache(TriageProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    CaffeineResultCache(TriageProperties properties, Ticker ticker) {
        long maximumSize = properties.getCache().getMaximumSize();
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(maximumSize)
                .ticker(ticker)
                .build();

        log.info("Initialized result cache: maximumSize={}", maximumSize);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of((T) entry.value());
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (value == null) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new Entry(value, ttl));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public List<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        return cache.asMap().keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .sorted()
                .toList();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private record Entry(Object value, Duration ttl) {}

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
