package com.clipforge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 生产流水线专用线程池，与调度线程解耦：tick 只负责派发，流水线在这里运行。
 * 拒绝策略固定为 AbortPolicy，调度方据此释放认领并计入 rejected。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ProductionWorkerProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "productionWorkerExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "productionWorkerExecutor")
    public ThreadPoolExecutor productionWorkerExecutor(ProductionWorkerProperties properties) {
        int coreSize = Math.max(valueOrDefault(properties.getCorePoolSize(), 4), 1);
        int maxSize = Math.max(valueOrDefault(properties.getMaxPoolSize(), coreSize), coreSize);
        long keepAliveSeconds = Math.max(properties.getKeepAliveSeconds() == null ? 60L : properties.getKeepAliveSeconds(), 0L);
        int queueCapacity = Math.max(valueOrDefault(properties.getQueueCapacity(), 0), 0);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        String threadNamePrefix = properties.getThreadNamePrefix() == null
                ? "production-worker-"
                : properties.getThreadNamePrefix();
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(false);
        log.info("Production worker pool created. coreSize={}, maxSize={}, queueCapacity={}",
                coreSize, maxSize, queueCapacity);
        return executor;
    }

    private int valueOrDefault(Integer value, int defaultValue) {
        return value == null ? defaultValue : value;
    }

}
