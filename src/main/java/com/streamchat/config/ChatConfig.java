package com.streamchat.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(ChatProperties.class)
public class ChatConfig {

    /* single time source for timestamps, slow mode, mute expiry and eviction */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /* runs one-shot room evictions and the @Scheduled idle sweep */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("chat-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /* drains each connection's outbound queue; a blocked write occupies one worker, never a room lock */
    @Bean
    public ThreadPoolTaskExecutor chatOutboundExecutor(ChatProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getOutboundPoolSize());
        executor.setMaxPoolSize(properties.getOutboundPoolSize());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("chat-outbound-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
