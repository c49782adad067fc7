package de.mirkosertic.nlpquery;

import de.mirkosertic.nlpquery.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The pipeline's work queue: a fixed pool of workers fed by a bounded queue. When the queue is full
 * the submitting thread runs the task itself.
 */
public class PipelineExecutor {

    private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);

    private final ThreadPoolExecutor executor;

    public PipelineExecutor(final ApplicationConfig config) {
        this(config.getWorkerThreads(), config.getQueueCapacity());
    }

    public PipelineExecutor(final int workerThreads, final int queueCapacity) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "nlp-query-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                workerThreads,
                workerThreads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("PipelineExecutor initialized with {} threads and a queue of {}", workerThreads, queueCapacity);
    }

    public <T> CompletableFuture<T> submit(final Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    public int queuedTasks() {
        return executor.getQueue().size();
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down PipelineExecutor");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("PipelineExecutor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for PipelineExecutor to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
