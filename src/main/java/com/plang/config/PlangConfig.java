package com.plang.config;

import com.plang.core.runtime.FactResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PlangConfig {

    /**
     * Worker pool for concurrent members of a stage. Closed with the application context.
     */
    @Bean(name = "policyExecutor", destroyMethod = "shutdownNow")
    public ExecutorService policyExecutor(PlangProperties properties) {
        var counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "plang-policy-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getParallelism()), factory);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * No external facts unless the application supplies its own resolver.
     */
    @Bean
    @ConditionalOnMissingBean
    public FactResolver factResolver() {
        return FactResolver.NONE;
    }
}
