/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named sample with its metadata and its ordered chunk references.
 * Datasets are read-only to the pipeline.
 */
public final class Dataset {
    private final String name;
    private final String shortName;
    private final boolean simulated;
    private final Double crossSection;
    private final Long declaredEvents;
    private final List<ChunkRef> chunks;

    private Dataset(final Builder b) {
        this.name = b.name;
        this.shortName = b.shortName == null ? b.name : b.shortName;
        this.simulated = b.simulated;
        this.crossSection = b.crossSection;
        this.declaredEvents = b.declaredEvents;
        final List<ChunkRef> l = new ArrayList<>();
        for (final ChunkRef.Source s : b.sources)
            l.add(new ChunkRef(name, l.size(), s.file(), s.start(), s.stop(), s.declared()));
        this.chunks = Collections.unmodifiableList(l);
    }

    public static Builder builder(final String name) {
        return new Builder(name);
    }

    /**
     * Same metadata, different chunk list (used to point a dataset at its skims)
     */
    public Dataset withSources(final List<ChunkRef.Source> sources) {
        final Builder b = builder(name).shortName(shortName);
        if (simulated)
            b.simulated(crossSection, declaredEvents);
        for (final ChunkRef.Source s : sources)
            b.chunk(s.file(), s.start(), s.stop(), s.declared());
        return b.build();
    }

    public String name() {
        return name;
    }

    /** histogram category; several datasets may share it */
    public String shortName() {
        return shortName;
    }

    public boolean isSimulated() {
        return simulated;
    }

    /**
     * @return cross-section in pb, or null for real data
     */
    public Double crossSection() {
        return crossSection;
    }

    /**
     * @return generated event count, or null for real data
     */
    public Long declaredEvents() {
        return declaredEvents;
    }

    public List<ChunkRef> chunks() {
        return chunks;
    }

    /** sum of declared entries over all chunks */
    public long declaredEntries() {
        long n = 0;
        for (final ChunkRef c : chunks)
            n += c.declaredEntries();
        return n;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof Dataset))
            return false;
        final Dataset d = (Dataset) o;
        return name.equals(d.name) && shortName.equals(d.shortName) && simulated == d.simulated
                && Objects.equals(crossSection, d.crossSection) && Objects.equals(declaredEvents, d.declaredEvents)
                && chunks.equals(d.chunks);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Dataset [name=" + name + ", shortName=" + shortName + ", simulated=" + simulated
                + (simulated ? ", xsec=" + crossSection + ", nevents=" + declaredEvents : "")
                + ", chunks=" + chunks.size() + "]";
    }

    public static final class Builder {
        private final String name;
        private String shortName;
        private boolean simulated;
        private Double crossSection;
        private Long declaredEvents;
        private final List<ChunkRef.Source> sources = new ArrayList<>();

        private Builder(final String name) {
            if (name == null || name.isEmpty())
                throw new IllegalArgumentException("dataset name");
            this.name = name;
        }

        public Builder shortName(final String shortName) {
            this.shortName = shortName;
            return this;
        }

        public Builder data() {
            this.simulated = false;
            this.crossSection = null;
            this.declaredEvents = null;
            return this;
        }

        public Builder simulated(final double crossSection, final long declaredEvents) {
            this.simulated = true;
            this.crossSection = crossSection;
            this.declaredEvents = declaredEvents;
            return this;
        }

        /**
         * Adds a chunk reading entries {@code [start, stop)} of {@code file}
         */
        public Builder chunk(final String file, final long start, final long stop) {
            return chunk(file, start, stop, stop - start);
        }

        /**
         * Adds a chunk reading entries {@code [start, stop)} of {@code file} that declares
         * {@code declared} entries
         */
        public Builder chunk(final String file, final long start, final long stop, final long declared) {
            if (start < 0 || stop < start)
                throw new IllegalArgumentException("invalid chunk range [" + start + ", " + stop + ") of " + file);
            if (declared < 0)
                throw new IllegalArgumentException("chunk of " + file + " declares " + declared + " entries");
            sources.add(new ChunkRef.Source(file, start, stop, declared));
            return this;
        }

        public Dataset build() {
            if (simulated) {
                if (crossSection == null || declaredEvents == null)
                    throw new IllegalArgumentException("simulated dataset " + name + " needs xsec and nevents");
                if (declaredEvents <= 0)
                    throw new IllegalArgumentException("simulated dataset " + name + " declares " + declaredEvents + " events");
            }
            return new Dataset(this);
        }
    }
}
