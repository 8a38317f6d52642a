package com.nms.alarmagent.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Client for the NMS REST gateway (token and subscription endpoints).
     */
    @Bean
    @Qualifier("nmsRestTemplate")
    public RestTemplate nmsRestTemplate(RestTemplateBuilder builder, SslBundles bundles, AgentProperties properties) {
        AgentProperties.Api api = properties.getApi();
        RestTemplateBuilder configured = builder
                .setConnectTimeout(api.getConnectTimeout())
                .setReadTimeout(api.getReadTimeout());

        String bundleName = api.getSslBundle();
        if (bundleName == null || bundleName.isBlank()) {
            log.info("No SSL bundle configured for the NMS API, using the default JVM trust store");
            return configured.build();
        }
        log.info("Using SSL bundle '{}' for the NMS API", bundleName);
        return configured.setSslBundle(bundles.getBundle(bundleName)).build();
    }

    /**
     * Runs the token refresh and subscription renewal tasks, isolated from request threads.
     */
    @Bean
    public ThreadPoolTaskScheduler agentTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("agent-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
