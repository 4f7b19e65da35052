package com.taskaggregator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * Operator 目录与签名校验调用专用线程池：
 * <ul>
 *   <li>与 HTTP 线程解耦，调用方可以按超时放弃等待</li>
 *   <li>超时后的调用会被中断 (Future.cancel)，线程回收到池中</li>
 *   <li>拒绝策略默认 AbortPolicy，池满时直接转换为协作方不可用</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    @Bean(name = "operatorGatewayExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "operatorGatewayExecutor")
    public ThreadPoolExecutor operatorGatewayExecutor(
            @Value("${operator.gateway.pool-size:16}") int poolSize,
            @Value("${operator.gateway.queue-capacity:256}") int queueCapacity,
            @Value("${operator.gateway.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${operator.gateway.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${operator.gateway.thread-name-prefix:operator-gateway-}") String threadNamePrefix) {
        int normalizedPoolSize = Math.max(poolSize, 1);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedPoolSize,
                normalizedPoolSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
