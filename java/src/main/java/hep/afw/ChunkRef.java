/**
 * 
 */
package hep.afw;

/**
 * Reference to one chunk of a dataset: entries {@code [start, stop)} of one source file.
 * 
 * The declared entry count is chunk metadata used for normalization. It equals the range
 * length for raw chunks; a chunk read from a skim keeps the count of the chunk it was
 * skimmed from.
 */
public final class ChunkRef {
    private final String dataset;
    private final int index;
    private final String file;
    private final long start;
    private final long stop;
    private final long declared;

    ChunkRef(final String dataset, final int index, final String file, final long start, final long stop,
            final long declared) {
        this.dataset = dataset;
        this.index = index;
        this.file = file;
        this.start = start;
        this.stop = stop;
        this.declared = declared;
    }

    public String dataset() {
        return dataset;
    }

    /** position of the chunk within its dataset, from 0 */
    public int index() {
        return index;
    }

    public String file() {
        return file;
    }

    public long start() {
        return start;
    }

    public long stop() {
        return stop;
    }

    /** number of rows this chunk reads from its file */
    public long length() {
        return stop - start;
    }

    /**
     * Entry count from the chunk metadata. This never looks at the rows actually read.
     */
    public long declaredEntries() {
        return declared;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof ChunkRef))
            return false;
        final ChunkRef c = (ChunkRef) o;
        return dataset.equals(c.dataset) && index == c.index && file.equals(c.file) && start == c.start && stop == c.stop
                && declared == c.declared;
    }

    @Override
    public int hashCode() {
        return dataset.hashCode() * 31 + index;
    }

    @Override
    public String toString() {
        return dataset + "#" + index + " [" + file + ":" + start + "-" + stop + "]";
    }

    /**
     * File range a chunk is built from
     */
    public static final class Source {
        private final String file;
        private final long start;
        private final long stop;
        private final long declared;

        public Source(final String file, final long start, final long stop) {
            this(file, start, stop, stop - start);
        }

        /**
         * @param declared entry count of the chunk metadata
         */
        public Source(final String file, final long start, final long stop, final long declared) {
            this.file = file;
            this.start = start;
            this.stop = stop;
            this.declared = declared;
        }

        public String file() {
            return file;
        }

        public long start() {
            return start;
        }

        public long stop() {
            return stop;
        }

        public long declared() {
            return declared;
        }
    }
}
