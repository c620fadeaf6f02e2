package com.example.websearcher.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor(@Value("${app.query.max-threads:10}") int maxThreads) {
        int threadCount = maxThreads > 0 ? maxThreads : 10;
        return Executors.newFixedThreadPool(threadCount, daemonThreads("query-worker"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService sessionReleaseExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("session-release"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
