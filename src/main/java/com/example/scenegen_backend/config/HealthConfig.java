package com.example.scenegen_backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator lumaHealth(@Qualifier("lumaWebClient") WebClient luma) {
        return () -> {
            try {
                // any HTTP answer means the provider is reachable, auth errors included
                Integer status = luma.get().uri("/generations?limit=1")
                        .exchangeToMono(resp -> Mono.just(resp.statusCode().value()))
                        .block(Duration.ofSeconds(3));
                return Health.up().withDetail("luma", "reachable").withDetail("status", status).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("luma", "unreachable").build();
            }
        };
    }
}
