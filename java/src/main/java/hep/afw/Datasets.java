/**
 * 
 */
package hep.afw;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dataset helpers
 */
public final class Datasets {
    private Datasets() {
    }

    /**
     * Logs chunk counts per category as a small table, with the total in the header row.
     * 
     * @param byShortName group by short name instead of the full dataset name
     */
    public static void summary(final Logger logger, final List<Dataset> datasets, final boolean byShortName) {
        final Map<String, Integer> byName = new LinkedHashMap<>();
        for (final Dataset d : datasets)
            byName.merge(byShortName ? d.shortName() : d.name(), d.chunks().size(), Integer::sum);

        int maxlen = "Category".length();
        int total = 0;
        for (final Map.Entry<String, Integer> e : byName.entrySet()) {
            maxlen = Math.max(maxlen, e.getKey().length());
            total += e.getValue();
        }

        logger.log("[DATASET] %-" + maxlen + "s | %,d", "Category", total);
        logger.log("[DATASET] %s-+-%s", "-".repeat(maxlen), "-".repeat(5));
        for (final Map.Entry<String, Integer> e : byName.entrySet())
            logger.log("[DATASET] %-" + maxlen + "s | %,d", e.getKey(), e.getValue());
    }

    /**
     * Leading {@code maxChunks} chunks of every dataset, all of them when negative
     */
    public static int limit(final Dataset dataset, final int maxChunks) {
        final int n = dataset.chunks().size();
        return maxChunks < 0 ? n : Math.min(n, maxChunks);
    }

    public static Dataset find(final List<Dataset> datasets, final String name) {
        for (final Dataset d : datasets)
            if (d.name().equals(name))
                return d;
        return null;
    }
}
