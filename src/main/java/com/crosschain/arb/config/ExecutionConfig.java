package com.crosschain.arb.config;

import com.crosschain.arb.core.execution.ExecutionRouterFactory;
import com.crosschain.arb.core.execution.TradeExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Scan worker pool and the active execution policy.
 */
@Configuration
public class ExecutionConfig {

    public static final String SCAN_EXECUTOR = "scanExecutor";

    /** Bounded pool for gas fetches and per-edge evaluations. The scheduler thread only coordinates. */
    @Bean(name = SCAN_EXECUTOR)
    public ThreadPoolTaskExecutor scanExecutor(ScanProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getWorkerThreads());
        e.setMaxPoolSize(properties.getWorkerThreads());
        e.setThreadNamePrefix("scan-executor-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationMillis(properties.getShutdownGraceMs());
        e.initialize();
        return e;
    }

    @Bean
    public TradeExecutor tradeExecutor(ExecutionRouterFactory factory, ExecutionProperties properties) {
        return factory.create(properties.getMode());
    }
}
