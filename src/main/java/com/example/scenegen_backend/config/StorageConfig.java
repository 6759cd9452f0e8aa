package com.example.scenegen_backend.config;

import com.example.scenegen_backend.service.Interfaces.StorageService;
import com.example.scenegen_backend.service.LocalStorageService;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties, Clock clock) {
        Path base = Path.of(properties.getBaseDir());
        var svc = new LocalStorageService(base, properties.getPublicPrefix(), properties.getPublicBaseUrl(),
                properties.getSigningSecret(), clock);
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, publicPrefix={}, publicBaseUrl={}", base, properties.getPublicPrefix(), properties.getPublicBaseUrl());
        return svc;
    }
}
