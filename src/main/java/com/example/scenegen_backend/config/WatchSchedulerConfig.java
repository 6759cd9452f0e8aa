package com.example.scenegen_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class WatchSchedulerConfig {

    @Bean(name = "watchTaskScheduler")
    public ThreadPoolTaskScheduler watchTaskScheduler(SceneProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getWatchPoolSize()));
        scheduler.setThreadNamePrefix("scene-watch-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
