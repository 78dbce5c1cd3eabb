package hep.afw;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Local threads that report themselves as spread over several nodes
 */
public final class MultiNodeScheduler implements ChunkScheduler {
    private final LocalChunkScheduler local = new LocalChunkScheduler(2);

    @Override
    public <T> Future<T> submit(final Callable<T> task) {
        return local.submit(task);
    }

    @Override
    public boolean isSingleNode() {
        return false;
    }

    @Override
    public int parallelism() {
        return local.parallelism();
    }

    @Override
    public void close() {
        local.close();
    }
}
