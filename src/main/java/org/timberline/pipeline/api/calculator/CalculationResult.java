package org.timberline.pipeline.api.calculator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.timberline.pipeline.api.grid.GridVariable;

/**
 * Output of one Calculator call for one tile.
 *
 * @param time      output time axis (epoch days), e.g. one entry per year
 * @param variables derived arrays by result name, each shaped {@code (time, tileLat, tileLon)}
 * @param errors    results that could not be produced
 */
public record CalculationResult(long[] time, Map<String, GridVariable> variables, List<CalculationError> errors) {

    public CalculationResult {
        Objects.requireNonNull(time, "time");
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(variables, "variables")));
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public static CalculationResult of(long[] time, Map<String, GridVariable> variables) {
        return new CalculationResult(time, variables, List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
