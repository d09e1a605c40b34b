package com.civic.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ScanInfrastructureConfig {

    /**
     * Bounded pool shared by per-metric baseline fetches and per-category detectors.
     * The two phases never overlap, so tasks never wait on each other inside the pool.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scanExecutor(AnomalyEngineConfig config) {
        int threads = Math.max(1, config.getScan().getParallelism());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "anomaly-scan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
