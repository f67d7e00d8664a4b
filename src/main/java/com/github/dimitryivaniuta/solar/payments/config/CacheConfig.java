package com.github.dimitryivaniuta.solar.payments.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentDetailsView;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Redis only holds a read view; Postgres stays the source of truth and every mutation evicts the entry.
 * Setting {@code spring.cache.type=none} switches caching off (tests, local runs without Redis).</p>
 */
@EnableCaching
@Configuration
public class CacheConfig {

    /**
     * Cache name for the payment details view, keyed by project id.
     */
    public static final String PAYMENT_DETAILS_CACHE = "paymentDetails";

    /**
     * Cache manager using Redis with JSON serialization.
     *
     * @param factory      redis connection factory
     * @param objectMapper application object mapper
     * @param props        application properties (TTL)
     * @return cache manager
     */
    @Bean
    @ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
    public RedisCacheManager cacheManager(RedisConnectionFactory factory, ObjectMapper objectMapper, AppProperties props) {
        var detailsSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, PaymentDetailsView.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var detailsCfg = defaultCfg
                .entryTtl(props.getCache().getDetailsTtl())
                .disableCachingNullValues()
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(detailsSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(PAYMENT_DETAILS_CACHE, detailsCfg)
                .build();
    }
}
