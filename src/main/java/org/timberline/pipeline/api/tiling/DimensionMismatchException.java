package org.timberline.pipeline.api.tiling;

import org.timberline.pipeline.api.grid.GridExtent;

/**
 * Thrown when gridded data does not have the shape it must have.
 * <p>
 * This indicates a tiling or merge bug, never a data problem that can be tolerated.
 * Callers must not pad or truncate around it: the affected chunk fails and the error
 * is logged at ERROR level.
 */
public class DimensionMismatchException extends IllegalStateException {

    private final String expected;
    private final String actual;

    /**
     * @param context  what was being validated (e.g. "merged chunk", "tile northwest")
     * @param expected the expected shape, rendered for humans
     * @param actual   the shape that was found
     */
    public DimensionMismatchException(String context, String expected, String actual) {
        super("Dimension mismatch in " + context + ": expected " + expected + ", actual " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public DimensionMismatchException(String context, GridExtent expected, GridExtent actual) {
        this(context, String.valueOf(expected), String.valueOf(actual));
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
