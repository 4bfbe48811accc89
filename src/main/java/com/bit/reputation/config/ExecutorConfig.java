package com.bit.reputation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 校验编排使用的IO线程池，哈希计算本身不需要线程池
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(name = "integrityExecutor", destroyMethod = "shutdown")
    public ExecutorService integrityExecutor(IntegrityConfig config) {
        int threads = Math.max(1, config.getIoThreads());
        log.info("创建完整性校验IO线程池，线程数: {}", threads);
        return newIoExecutor(threads);
    }

    /**
     * 有界队列，队列满时由调用线程执行
     */
    public static ExecutorService newIoExecutor(int threads) {
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(10_000),
                new IoThreadFactory(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    static class IoThreadFactory implements ThreadFactory {
        private final AtomicInteger index = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "integrity-io-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
