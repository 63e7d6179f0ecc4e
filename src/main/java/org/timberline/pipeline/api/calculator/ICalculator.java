package org.timberline.pipeline.api.calculator;

import java.util.Map;
import java.util.Set;

import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.reference.ReferenceSurface;

/**
 * Domain-specific function that turns a gridded input slice (plus reference surfaces
 * pre-sliced to the same window) into named derived arrays.
 * <p>
 * Implementations are loaded reflectively from {@code pipeline.calculator.className}
 * and must offer a public constructor taking the {@code pipeline.calculator.options}
 * {@link com.typesafe.config.Config}. One instance is shared by all tiles of a run, so
 * {@link #compute} must be safe to call concurrently.
 */
public interface ICalculator {

    /**
     * Short name recorded in output metadata.
     */
    String name();

    /**
     * Names of the reference surfaces this Calculator reads. Only these are loaded.
     */
    Set<String> requiredReferences();

    /**
     * Computes derived results for one tile.
     *
     * @param input      input restricted to the tile, full chunk time range
     * @param references reference surfaces restricted to the tile, keyed by name
     * @return results and per-result errors
     * @throws CalculationException if nothing at all can be computed
     */
    CalculationResult compute(GridDataset input, Map<String, ReferenceSurface> references)
        throws CalculationException;

    /**
     * Global attributes to record on every chunk output.
     */
    default Map<String, String> globalAttributes() {
        return Map.of();
    }
}
