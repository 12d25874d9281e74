package taskmesh.node.scheduler;

import taskmesh.node.config.NodeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The node's coordination loop.
 *
 * One daemon thread owns every piece of node state: the periodic sync tick,
 * public operations and session callbacks all run on it, so registry, queue
 * and session bookkeeping need no locks.
 */
public class NodeScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeScheduler.class);

    private final ScheduledExecutorService executor;
    private final Runnable syncTick;
    private final NodeConfig config;

    private volatile boolean running = false;

    /**
     * @param syncTick periodic work, typically a {@link SyncTick}
     * @param config   configuration
     */
    public NodeScheduler(Runnable syncTick, NodeConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskmesh-coordination");
            t.setDaemon(true);
            return t;
        });
        this.syncTick = syncTick;
        this.config = config;
    }

    /**
     * Start ticking.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long tickMs = config.tickInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("sync-tick", syncTick),
                tickMs, // initial delay
                tickMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Sync tick scheduled every {}ms", tickMs);
    }

    /**
     * Stop the loop gracefully.
     */
    public void stop() {
        if (!running) {
            executor.shutdownNow();
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** Executor that runs work on the coordination thread. */
    public Executor executor() {
        return executor;
    }

    /**
     * Run {@code work} on the coordination thread. Exceptions complete the
     * returned future exceptionally.
     */
    public <T> CompletableFuture<T> submit(Callable<T> work) {
        return submitTo(executor, work);
    }

    /** Same as {@link #submit} against an arbitrary loop executor. */
    public static <T> CompletableFuture<T> submitTo(Executor loop, Callable<T> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                try {
                    result.complete(work.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            // rejected after shutdown
            result.completeExceptionally(e);
        }
        return result;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
