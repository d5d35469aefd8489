package com.jreinhal.askdocs.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for the blocking backend calls of the query pipeline: retrieval (dense and
 * lexical, per sub-query), reranking, completion calls, and trace export.
 *
 * <p>Each pool rejects with {@link RejectedExecutionException} when its queue is full rather
 * than running the task on the request thread; callers treat a rejection as that backend being
 * unavailable.</p>
 */
@Configuration
public class RagPerformanceConfig {

    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);
    private final ObjectProvider<MeterRegistry> meterRegistry;

    public RagPerformanceConfig(ObjectProvider<MeterRegistry> meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Bean(name = {"retrievalExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor retrievalExecutor(
            @Value("${askdocs.performance.retrieval-core-threads:4}") int coreThreads,
            @Value("${askdocs.performance.retrieval-max-threads:8}") int maxThreads,
            @Value("${askdocs.performance.retrieval-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("retrieval-exec-", coreThreads, maxThreads, queueCapacity);
    }

    @Bean(name = {"rerankerExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor rerankerExecutor(
            @Value("${askdocs.performance.reranker-threads:4}") int threads) {
        return this.buildExecutor("rerank-exec-", threads, threads, Math.max(50, threads * 10));
    }

    @Bean(name = {"llmExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor llmExecutor(
            @Value("${askdocs.performance.llm-threads:4}") int threads,
            @Value("${askdocs.performance.llm-queue-capacity:100}") int queueCapacity) {
        return this.buildExecutor("llm-exec-", threads, threads, queueCapacity);
    }

    @Bean(name = {"traceExportExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor traceExportExecutor() {
        return this.buildExecutor("trace-export-", 1, 1, 500);
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadFactory threadFactory = new NamedThreadFactory(prefix);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), threadFactory, new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        this.meterRegistry.ifAvailable(registry ->
                new ExecutorServiceMetrics(executor, prefix.substring(0, prefix.length() - 1), Tags.empty()).bindTo(registry));
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}', queue full. active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
