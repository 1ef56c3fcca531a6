package com.nikoh.matchmaking.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async Processing Configuration
 *
 * OCR, MRZ and face extraction take seconds per document and run on a
 * dedicated pool so request threads return immediately with a
 * "processing" verification.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfiguration implements AsyncConfigurer {

    public static final String DOCUMENT_PROCESSING_EXECUTOR = "documentProcessingExecutor";

    /**
     * DOCUMENT PROCESSING EXECUTOR
     *
     * Small pool: work is CPU bound and the native runtimes serialise inference.
     *
     * Use with: @Async(AsyncConfiguration.DOCUMENT_PROCESSING_EXECUTOR)
     */
    @Bean(name = DOCUMENT_PROCESSING_EXECUTOR)
    public Executor documentProcessingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int cores = Runtime.getRuntime().availableProcessors();
        executor.setCorePoolSize(Math.max(2, cores / 2));
        executor.setMaxPoolSize(Math.max(4, cores));
        executor.setQueueCapacity(200);

        executor.setThreadNamePrefix("document-processing-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setRejectedExecutionHandler(new CallerRunsWithLogging());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);

        executor.initialize();

        log.info("Initialized document processing executor - Core: {}, Max: {}, Queue: {}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), 200);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return documentProcessingExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) ->
                log.error("Uncaught exception in async method {}", method.getName(), throwable);
    }

    /**
     * Copies the submitting thread's MDC so worker logs keep the request trace id
     */
    static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        }
    }

    /**
     * Runs the task on the caller when the pool is saturated so no upload is dropped
     */
    @Slf4j
    static class CallerRunsWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (!executor.isShutdown()) {
                log.warn("Document processing pool saturated, running task in caller thread - " +
                                "Pool: {}, Active: {}, Queue: {}",
                        executor.getPoolSize(),
                        executor.getActiveCount(),
                        executor.getQueue().size());
                r.run();
            } else {
                log.error("Executor shut down, document processing task rejected: {}", r);
            }
        }
    }
}
