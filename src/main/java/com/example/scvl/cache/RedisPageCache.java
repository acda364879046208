package com.example.scvl.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Component
public class RedisPageCache implements PageCache {

    static final String URL_KEY_PREFIX = "url:";
    static final String OGP_KEY_PREFIX = "ogp:";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public RedisPageCache(StringRedisTemplate redisTemplate, @Value("${app.cache.ttl:24h}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public Optional<String> getUrl(String slug) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(URL_KEY_PREFIX + slug));
        } catch (RuntimeException e) {
            log.warn("Redis GET url failed for slug {}, treating as miss: {}", slug, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void setUrl(String slug, String url) {
        try {
            redisTemplate.opsForValue().set(URL_KEY_PREFIX + slug, url, ttl);
        } catch (RuntimeException e) {
            log.warn("Redis SET url failed for slug {}: {}", slug, e.getMessage());
        }
    }

    @Override
    public long getOgpId(String slug) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(OGP_KEY_PREFIX + slug);
        } catch (RuntimeException e) {
            log.warn("Redis GET ogp failed for slug {}, treating as miss: {}", slug, e.getMessage());
            return 0L;
        }
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed OGP id '{}' cached for slug {}", value, slug);
            return 0L;
        }
    }

    @Override
    public void setOgpId(String slug, long ogpId) {
        try {
            redisTemplate.opsForValue().set(OGP_KEY_PREFIX + slug, String.valueOf(ogpId), ttl);
        } catch (RuntimeException e) {
            log.warn("Redis SET ogp failed for slug {}: {}", slug, e.getMessage());
        }
    }

    @Override
    public void deleteOgpId(String slug) {
        try {
            redisTemplate.delete(OGP_KEY_PREFIX + slug);
        } catch (RuntimeException e) {
            log.warn("Redis DEL ogp failed for slug {}: {}", slug, e.getMessage());
        }
    }
}
