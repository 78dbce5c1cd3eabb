/**
 * 
 */
package hep.afw;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Draws one reduced accumulator.
 * 
 * A renderer sees nothing but the reduced result, so that plots can be drawn again from
 * a saved results file. Output must depend on its arguments only.
 */
public interface PlotRenderer {

    /**
     * @param extension file extension without the dot, such as {@code svg}
     */
    boolean supports(String extension);

    /**
     * @param result         reduced accumulator with its completeness
     * @param options        rendering hints of the histogram spec
     * @param dataCategories categories filled from real data, drawn as points
     * @param out            destination, left open
     */
    void render(Reducer.Result result, HistogramSpec.PlotOptions options, List<String> dataCategories, OutputStream out)
            throws IOException;
}
