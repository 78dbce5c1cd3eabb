/**
 * 
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the stages and every histogram fill of one chunk.
 * 
 * Chunk-local failures (see {@link ErrorCode#isFatal()}) come back as a failed
 * {@link Outcome}; nothing of a failed chunk reaches the reducer. Runtime exceptions
 * thrown by analysis code count as {@link ErrorCode#DATA_ERROR}. Fatal errors are thrown.
 */
public final class ChunkExecutor {
    private final StagePipeline pipeline;
    private final Augmenter augmenter;
    private final List<HistogramSpec> specs;
    private final boolean renormalizeLimited;
    private final Logger logger;

    public ChunkExecutor(final StagePipeline pipeline, final Augmenter augmenter, final List<HistogramSpec> specs,
            final boolean renormalizeLimited, final Logger logger) {
        this.pipeline = pipeline;
        this.augmenter = augmenter;
        this.specs = specs;
        this.renormalizeLimited = renormalizeLimited;
        this.logger = logger;
    }

    public Outcome execute(final Dataset dataset, final ChunkRef chunk, final Normalization normalization)
            throws PipelineException {
        final IO.StopWatch watch = new IO.StopWatch();
        int rows = 0;
        try {
            final Events raw = read(chunk);
            rows = raw.rows();
            final Events selected = pipeline.apply(raw);
            final Augmentation augmentation = augmenter.augment(selected);
            final double[] weights = Weights.of(selected, normalization, renormalizeLimited);

            final Map<String, Hist> partial = new LinkedHashMap<>();
            for (final HistogramSpec spec : specs) {
                final Hist h = spec.create();
                spec.fill(h, selected, dataset.shortName(), weights.clone(), augmentation);
                partial.put(spec.name(), h);
            }
            logger.debug("[CHUNK] %s rows=%d selected=%d in %,d ms", chunk, rows, selected.rows(), watch.elapsed());
            return new Outcome(chunk, partial, rows, null);
        } catch (PipelineException ex) {
            if (ex.isFatal())
                throw ex;
            return new Outcome(chunk, null, rows, ex);
        } catch (RuntimeException ex) {
            return new Outcome(chunk, null, rows,
                    new PipelineException(ErrorCode.DATA_ERROR, chunk + ": " + ex, ex));
        }
    }

    /**
     * Rows of one chunk, checked against the length of its entry range
     */
    public static Events read(final ChunkRef chunk) throws PipelineException {
        try {
            final Events events = EventFile.read(new File(chunk.file()), chunk.start(), chunk.stop());
            if (events.rows() != chunk.length())
                throw PipelineException.data("chunk %s spans %d entries, file holds %d", chunk, chunk.length(),
                        events.rows());
            return events;
        } catch (PipelineException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new PipelineException(ErrorCode.DATA_ERROR, "cannot read " + chunk + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Result of one chunk: its accumulators, or the error that failed it
     */
    public static final class Outcome {
        private final ChunkRef chunk;
        private final Map<String, Hist> partial;
        private final int rows;
        private final PipelineException error;

        Outcome(final ChunkRef chunk, final Map<String, Hist> partial, final int rows, final PipelineException error) {
            this.chunk = chunk;
            this.partial = partial;
            this.rows = rows;
            this.error = error;
        }

        public ChunkRef chunk() {
            return chunk;
        }

        public boolean isSuccess() {
            return error == null;
        }

        public Map<String, Hist> partial() {
            return partial;
        }

        /** rows read from the source, before any stage */
        public int rows() {
            return rows;
        }

        public PipelineException error() {
            return error;
        }
    }
}
