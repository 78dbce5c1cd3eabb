/**
 * 
 */
package hep.afw;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed thread pool on the local machine
 */
public final class LocalChunkScheduler implements ChunkScheduler {
    private static final AtomicInteger POOLS = new AtomicInteger();

    private final ExecutorService pool;
    private final int threads;

    public LocalChunkScheduler(final int threads) {
        this.threads = Math.max(1, threads);
        final int id = POOLS.incrementAndGet();
        final AtomicInteger n = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(this.threads, r -> {
            final Thread t = new Thread(r, "chunk-" + id + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public <T> Future<T> submit(final Callable<T> task) {
        return pool.submit(task);
    }

    @Override
    public boolean isSingleNode() {
        return true;
    }

    @Override
    public int parallelism() {
        return threads;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(1, TimeUnit.SECONDS))
                pool.shutdownNow();
        } catch (InterruptedException ex) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
