package com.example.careplan.cost.cache;

import com.example.careplan.cost.model.CostBreakdown;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Reactive Redis template for the shared cost cache.
 */
@Configuration
@ConditionalOnProperty(name = "careplan.cache.store", havingValue = "redis")
public class CostCacheConfig {

    public static final String COST_CACHE_TEMPLATE = "costCacheTemplate";

    /**
     * Values are written as plain JSON of a single known type, so no type metadata is stored.
     */
    @Bean(COST_CACHE_TEMPLATE)
    public ReactiveRedisTemplate<String, CostBreakdown> costCacheTemplate(
            ReactiveRedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        StringRedisSerializer keySerializer = new StringRedisSerializer();
        Jackson2JsonRedisSerializer<CostBreakdown> valueSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, CostBreakdown.class);

        RedisSerializationContext<String, CostBreakdown> serializationContext =
                RedisSerializationContext.<String, CostBreakdown>newSerializationContext(keySerializer)
                        .value(valueSerializer)
                        .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }
}
