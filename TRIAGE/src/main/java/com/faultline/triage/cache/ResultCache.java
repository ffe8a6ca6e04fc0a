package com.faultline.triage.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key/value memo for analysis results with per-entry expiry.
 */
public interface ResultCache {

    /**
     * Cached value for {@code key}, empty when absent or expired.
     */
    <T> Optional<T> get(String key);

    void set(String key, Object value, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Live keys matching a glob pattern ({@code *} and {@code ?} wildcards).
     */
    List<String> keys(String pattern);

    long size();
}
