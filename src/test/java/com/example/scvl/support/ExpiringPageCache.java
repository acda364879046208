package com.example.scvl.support;

import com.example.scvl.cache.PageCache;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cache whose keys expire like Redis keys: every set restarts that key's TTL. Time only moves
 * when {@link #advance(Duration)} is called.
 */
public class ExpiringPageCache implements PageCache {

    private final Duration ttl;
    private final Map<String, Entry> entries = new HashMap<>();
    private Instant now = Instant.EPOCH;

    public ExpiringPageCache(Duration ttl) {
        this.ttl = ttl;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    @Override
    public Optional<String> getUrl(String slug) {
        return Optional.ofNullable(get("url:" + slug));
    }

    @Override
    public void setUrl(String slug, String url) {
        entries.put("url:" + slug, new Entry(url, now.plus(ttl)));
    }

    @Override
    public long getOgpId(String slug) {
        String value = get("ogp:" + slug);
        return value == null ? 0L : Long.parseLong(value);
    }

    @Override
    public void setOgpId(String slug, long ogpId) {
        entries.put("ogp:" + slug, new Entry(Long.toString(ogpId), now.plus(ttl)));
    }

    @Override
    public void deleteOgpId(String slug) {
        entries.remove("ogp:" + slug);
    }

    private String get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || !now.isBefore(entry.expiresAt)) {
            entries.remove(key);
            return null;
        }
        return entry.value;
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
