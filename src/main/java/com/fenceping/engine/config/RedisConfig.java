package com.fenceping.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenceping.engine.model.ContainmentState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the shared containment state cache.
 *
 * Only active with {@code fenceping.engine.state.cache-type=redis}. With the default
 * in-process cache the engine never opens a Redis connection.
 *
 * Storage:
 * - Key: String, e.g. "containment:{deviceId}:{geofenceId}"
 * - Value: ContainmentState as JSON, written with the application ObjectMapper
 *   so Instants and enums serialize the same way as on the REST API
 */
@Configuration
@ConditionalOnProperty(name = "fenceping.engine.state.cache-type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisTemplate<String, ContainmentState> containmentStateRedisTemplate(
            RedisConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        RedisTemplate<String, ContainmentState> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new Jackson2JsonRedisSerializer<>(objectMapper, ContainmentState.class));

        template.afterPropertiesSet();
        return template;
    }
}
