package org.timberline.pipeline.api.grid;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.timberline.pipeline.api.tiling.DimensionMismatchException;

/**
 * A named float array of shape {@code (time, lat, lon)}, stored row-major.
 * <p>
 * The constructor takes ownership of the value array; callers must not modify it
 * afterwards. All derived arrays ({@link #slice}, {@link GridDataset#concat}) are
 * fresh copies, so a variable never aliases the storage of another one.
 */
public final class GridVariable {

    public static final String ATTR_UNITS = "units";
    public static final String ATTR_LONG_NAME = "long_name";
    public static final String ATTR_STANDARD_NAME = "standard_name";

    private final String name;
    private final int timeCount;
    private final int latCount;
    private final int lonCount;
    private final float[] values;
    private final Map<String, String> attributes;

    public GridVariable(String name, int timeCount, int latCount, int lonCount,
                        float[] values, Map<String, String> attributes) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = Objects.requireNonNull(values, "values");
        if (timeCount < 0 || latCount <= 0 || lonCount <= 0) {
            throw new IllegalArgumentException("Invalid shape for variable '" + name + "': ("
                + timeCount + ", " + latCount + ", " + lonCount + ")");
        }
        long expected = (long) timeCount * latCount * lonCount;
        if (values.length != expected) {
            throw new DimensionMismatchException("variable '" + name + "'",
                expected + " values", values.length + " values");
        }
        this.timeCount = timeCount;
        this.latCount = latCount;
        this.lonCount = lonCount;
        this.attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a variable of the given shape where every cell holds {@code fill}.
     */
    public static GridVariable filled(String name, int timeCount, int latCount, int lonCount,
                                      float fill, Map<String, String> attributes) {
        float[] values = new float[Math.multiplyExact(Math.multiplyExact(timeCount, latCount), lonCount)];
        Arrays.fill(values, fill);
        return new GridVariable(name, timeCount, latCount, lonCount, values, attributes);
    }

    public String name() {
        return name;
    }

    public int timeCount() {
        return timeCount;
    }

    public int latCount() {
        return latCount;
    }

    public int lonCount() {
        return lonCount;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public String units() {
        return attributes.get(ATTR_UNITS);
    }

    public float get(int t, int lat, int lon) {
        return values[index(t, lat, lon)];
    }

    /**
     * Returns a copy of the raw row-major values.
     */
    public float[] toArray() {
        return values.clone();
    }

    /**
     * Copies one {@code (lat, lon)} row segment into {@code dest}. Used by concatenation
     * and slicing, which are the only places that need bulk access.
     */
    void copyRow(int t, int lat, int lonFrom, float[] dest, int destPos, int length) {
        System.arraycopy(values, index(t, lat, lonFrom), dest, destPos, length);
    }

    /**
     * Returns a new variable restricted to the given spatial window, all time steps kept.
     */
    public GridVariable slice(IndexRange latRange, IndexRange lonRange) {
        if (latRange.end() > latCount || lonRange.end() > lonCount) {
            throw new DimensionMismatchException("slice of '" + name + "'",
                "window within " + latCount + "x" + lonCount,
                "lat" + latRange + " lon" + lonRange);
        }
        int outLat = latRange.length();
        int outLon = lonRange.length();
        float[] out = new float[timeCount * outLat * outLon];
        for (int t = 0; t < timeCount; t++) {
            for (int la = 0; la < outLat; la++) {
                copyRow(t, latRange.start() + la, lonRange.start(), out, (t * outLat + la) * outLon, outLon);
            }
        }
        return new GridVariable(name, timeCount, outLat, outLon, out, attributes);
    }

    public GridVariable withAttributes(Map<String, String> newAttributes) {
        return new GridVariable(name, timeCount, latCount, lonCount, values, newAttributes);
    }

    /**
     * Compares shape and values; NaN cells compare equal to NaN cells.
     */
    public boolean sameValues(GridVariable other) {
        return timeCount == other.timeCount && latCount == other.latCount && lonCount == other.lonCount
            && Arrays.equals(values, other.values);
    }

    private int index(int t, int lat, int lon) {
        return (t * latCount + lat) * lonCount + lon;
    }

    @Override
    public String toString() {
        return name + "(" + timeCount + ", " + latCount + ", " + lonCount + ")";
    }
}
