/**
 * 
 */
package hep.afw;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Runs chunk tasks.
 * 
 * {@link #isSingleNode()} tells whether every task runs on this machine. Node-local skim
 * storage is only valid when it does.
 */
public interface ChunkScheduler extends AutoCloseable {

    <T> Future<T> submit(Callable<T> task);

    boolean isSingleNode();

    /** number of tasks that may run at the same time */
    int parallelism();

    @Override
    void close();
}
