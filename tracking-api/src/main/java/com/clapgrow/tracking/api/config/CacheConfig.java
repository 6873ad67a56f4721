package com.clapgrow.tracking.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.JdkSerializationRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis-backed caches for the lookups on the beacon and redirect hot path.
 *
 * Cached values are small Serializable view records, never entities.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CAMPAIGN_SETTINGS = "campaignTrackingSettings";
    public static final String TRACKED_MESSAGES = "trackedMessages";
    public static final String OPT_OUTS = "optOuts";

    @Value("${tracking.cache.ttl:10m}")
    private Duration defaultTtl;

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(defaultTtl)
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(
                        new JdkSerializationRedisSerializer(getClass().getClassLoader())))
                .disableCachingNullValues();

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();

        // Flags rarely change and are evicted on write
        cacheConfigurations.put(CAMPAIGN_SETTINGS,
                defaultConfig.entryTtl(Duration.ofMinutes(30)).prefixCacheNameWith("tracking:cache:"));

        // Message registration is immutable after send
        cacheConfigurations.put(TRACKED_MESSAGES,
                defaultConfig.entryTtl(Duration.ofHours(6)).prefixCacheNameWith("tracking:cache:"));

        // Opt-out writes evict; TTL bounds staleness if another instance wrote
        cacheConfigurations.put(OPT_OUTS,
                defaultConfig.entryTtl(Duration.ofMinutes(5)).prefixCacheNameWith("tracking:cache:"));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaultConfig)
                .withInitialCacheConfigurations(cacheConfigurations)
                .transactionAware()
                .build();

        log.info("Redis cache manager configured with {} caches", cacheConfigurations.size());
        return cacheManager;
    }
}
