/**
 * 
 */
package hep.afw;

/**
 * Computes the {@link Augmentation} of one chunk from its fully selected events.
 * Implementations must be deterministic and free of side effects, so a retried chunk
 * sees the same values.
 */
@FunctionalInterface
public interface Augmenter {
    Augmenter NONE = events -> Augmentation.EMPTY;

    Augmentation augment(Events events) throws PipelineException;
}
