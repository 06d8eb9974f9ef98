package com.catalogsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CrawlConfig {

    /**
     * Every submitted session task gets a fresh thread; a session resumed after confirmation
     * therefore never shares a worker with its collection phase.
     */
    @Bean(name = "crawlSessionExecutor")
    public Executor crawlSessionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task);
            thread.setName("crawl-session-" + counter.incrementAndGet());
            thread.setDaemon(false);
            thread.start();
        };
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(4);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
