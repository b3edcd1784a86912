package io.hfmcp.gateway.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.hfmcp.gateway.model.RemoteEndpoint.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-memory caches backed by Caffeine.
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    /**
     * Space name to visibility, so repeated sessions do not look up the same space again.
     */
    @Bean
    public Cache<String, Visibility> spaceVisibilityCache(GatewayProperties properties) {
        GatewayProperties.CacheConfig cache = properties.getCache();
        log.info("Created space visibility cache (ttl: {}, max size: {})", cache.getVisibilityTtl(), cache.getMaxSize());
        return Caffeine.newBuilder()
            .expireAfterWrite(cache.getVisibilityTtl())
            .maximumSize(cache.getMaxSize())
            .build();
    }
}
