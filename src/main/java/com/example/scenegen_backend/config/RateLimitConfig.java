package com.example.scenegen_backend.config;

import com.example.scenegen_backend.repository.RateLimitWindowRepository;
import com.example.scenegen_backend.service.InMemoryRateLimiter;
import com.example.scenegen_backend.service.Interfaces.RateLimiter;
import com.example.scenegen_backend.service.JdbcRateLimiter;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    @Bean
    @ConditionalOnProperty(prefix = "ratelimit", name = "store", havingValue = "memory", matchIfMissing = true)
    public RateLimiter inMemoryRateLimiter(RateLimitProperties props, Clock clock) {
        LoggerFactory.getLogger(RateLimitConfig.class)
                .warn("Rate limiter store=memory: counters are per instance, use ratelimit.store=jdbc when scaling out");
        return new InMemoryRateLimiter(props.getWindow(), props.getMaxRequests(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ratelimit", name = "store", havingValue = "jdbc")
    public RateLimiter jdbcRateLimiter(RateLimitProperties props, RateLimitWindowRepository repository, Clock clock) {
        return new JdbcRateLimiter(repository, props.getWindow(), props.getMaxRequests(), clock);
    }
}
