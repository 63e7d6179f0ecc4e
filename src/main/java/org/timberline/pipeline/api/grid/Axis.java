package org.timberline.pipeline.api.grid;

/**
 * Dimensions of a gridded dataset, in storage order.
 */
public enum Axis {
    TIME,
    LAT,
    LON
}
