package com.example.scenegen_backend.config;

import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.scenegen_backend.engine.LumaVideoEngine;
import com.example.scenegen_backend.service.ProviderErrorClassifier;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties({LumaProperties.class, SceneProperties.class})
public class LumaClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(LumaClientConfig.class);
    private static final int MAX_CONNECTIONS = 20;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);
    private static final int MAX_ASSET_BYTES = 512 * 1024 * 1024;

    @Bean("lumaWebClient")
    WebClient lumaWebClient(LumaProperties props) {
        Duration timeout = Duration.ofSeconds(props.getTimeoutSeconds());
        HttpClient httpClient = httpClient("luma-http", timeout, props.getConnectTimeoutMillis());

        LOGGER.info("Configuring Luma WebClient baseUrl={} connect={}ms response={}s model={} maxAttempts={}",
                props.getBaseUrl(), props.getConnectTimeoutMillis(), timeout.toSeconds(), props.getModel(), props.getMaxAttempts());

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json");
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey().trim());
        } else {
            LOGGER.warn("luma.api-key is not set; provider calls will be rejected");
        }
        return builder.build();
    }

    @Bean("assetWebClient")
    WebClient assetWebClient(LumaProperties props, SceneProperties sceneProps) {
        Duration timeout = Duration.ofSeconds(sceneProps.getDownloadTimeoutSeconds());
        HttpClient httpClient = httpClient("asset-http", timeout, props.getConnectTimeoutMillis())
                .followRedirect(true);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_ASSET_BYTES))
                .build();
    }

    @Bean
    VideoGenerationEngine videoGenerationEngine(@Qualifier("lumaWebClient") WebClient lumaWebClient,
                                                @Qualifier("assetWebClient") WebClient assetWebClient,
                                                LumaProperties props,
                                                SceneProperties sceneProps,
                                                ProviderErrorClassifier classifier) {
        return new LumaVideoEngine(lumaWebClient, assetWebClient, props, classifier,
                Duration.ofSeconds(sceneProps.getDownloadTimeoutSeconds()));
    }

    private static HttpClient httpClient(String poolName, Duration timeout, int connectTimeoutMillis) {
        ConnectionProvider provider = ConnectionProvider.builder(poolName)
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        return HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS)));
    }
}
