package com.scrapouille.dashboard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DashboardConfig {

    /**
     * Worker pool for extraction invocations. Sized to the largest concurrency limit a batch may
     * request; the scheduler bounds how many of these threads one batch actually occupies.
     */
    @Bean(name = "extractionExecutor", destroyMethod = "shutdown")
    public ExecutorService extractionExecutor(DashboardProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getMaxConcurrency(), namedThreads("extraction-worker"));
    }

    @Bean(name = "batchRunExecutor", destroyMethod = "shutdown")
    public ExecutorService batchRunExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("batch-run"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(DashboardProperties properties) {
        int size = Math.max(4, properties.getBatch().getMaxConcurrency() * 2);
        return Executors.newFixedThreadPool(size, namedThreads("extraction-http"));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
