/**
 * 
 */
package hep.afw;

import java.io.IOException;
import java.util.List;

/**
 * Resolves the datasets of an analysis: their files, chunks and sample metadata.
 */
@FunctionalInterface
public interface DatasetSource {

    /**
     * @return datasets in a stable order; the order decides the order of reduction
     */
    List<Dataset> datasets() throws IOException;
}
