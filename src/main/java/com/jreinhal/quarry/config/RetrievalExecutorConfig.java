package com.jreinhal.quarry.config;

import com.jreinhal.quarry.rag.fusion.RetrievalChannel;
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
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Worker pools of the reader pipeline.
 *
 * <p>The retrieval pool holds one thread per read a question can fan out (every channel plus the
 * doc-hint prefetch) for each question answered concurrently, so a single question never queues
 * behind itself. The rerank pool holds one scoring batch per concurrent question. A saturated pool
 * throws {@link RejectedExecutionException}; callers report it as a failure of the read they were
 * submitting.</p>
 */
@Configuration
public class RetrievalExecutorConfig {
    private static final Logger log = LoggerFactory.getLogger(RetrievalExecutorConfig.class);
    static final int READS_PER_QUESTION = RetrievalChannel.values().length + 1;

    @Bean(name = {"retrievalExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor retrievalExecutor(
            @Value(value="${quarry.performance.concurrent-questions:2}") int concurrentQuestions,
            @Value(value="${quarry.performance.retrieval-queue-capacity:200}") int queueCapacity) {
        int threads = READS_PER_QUESTION * Math.max(1, concurrentQuestions);
        return ReaderPool.RETRIEVAL.newExecutor(threads, Math.max(threads, queueCapacity));
    }

    @Bean(name = {"rerankerExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor rerankerExecutor(
            @Value(value="${quarry.rerank.batch-size:5}") int batchSize,
            @Value(value="${quarry.performance.concurrent-questions:2}") int concurrentQuestions) {
        int threads = Math.max(1, batchSize) * Math.max(1, concurrentQuestions);
        return ReaderPool.RERANK.newExecutor(threads, threads * 4);
    }

    @Bean(name = {"fallbackExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor fallbackExecutor(
            @Value(value="${quarry.performance.fallback-concurrency:2}") int concurrency) {
        int threads = Math.max(1, concurrency);
        return ReaderPool.FALLBACK.newExecutor(threads, threads * 10);
    }

    public enum ReaderPool {
        RETRIEVAL("quarry-retrieval-", "chunk store read"),
        RERANK("quarry-rerank-", "rerank scoring"),
        FALLBACK("quarry-fallback-", "generative fallback");

        private final String threadPrefix;
        private final String work;

        private ReaderPool(String threadPrefix, String work) {
            this.threadPrefix = threadPrefix;
            this.work = work;
        }

        public String getThreadPrefix() {
            return this.threadPrefix;
        }

        public String getWork() {
            return this.work;
        }

        ThreadPoolExecutor newExecutor(int threads, int queueCapacity) {
            AtomicInteger counter = new AtomicInteger();
            ThreadFactory threadFactory = runnable -> {
                Thread thread = new Thread(runnable, this.threadPrefix + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
            ThreadPoolExecutor executor = new ThreadPoolExecutor(threads, threads, 30L, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(queueCapacity), threadFactory, new SaturationHandler(this));
            executor.allowCoreThreadTimeOut(true);
            log.info("Pool for {} ready: threads={}, queue={}", new Object[]{this.work, threads, queueCapacity});
            return executor;
        }
    }

    public static final class SaturationHandler implements RejectedExecutionHandler {
        private final ReaderPool pool;
        private final AtomicLong rejected = new AtomicLong(0);

        SaturationHandler(ReaderPool pool) {
            this.pool = pool;
        }

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long count = this.rejected.incrementAndGet();
            log.warn("Rejected {} task: pool saturated (active={}, queued={}, rejectedSoFar={})",
                    new Object[]{this.pool.getWork(), executor.getActiveCount(), executor.getQueue().size(), count});
            throw new RejectedExecutionException("No capacity for " + this.pool.getWork() + " (" + count + " rejected so far)");
        }

        public ReaderPool getPool() {
            return this.pool;
        }

        public long getRejectionCount() {
            return this.rejected.get();
        }
    }
}
