package org.timberline.pipeline.api.grid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.timberline.pipeline.api.tiling.DimensionMismatchException;

/**
 * Self-describing gridded dataset: coordinates, named variables sharing those
 * coordinates, global attributes and a missing-value sentinel.
 * <p>
 * Instances are immutable. {@link #slice} and {@link #concat} always return datasets
 * backed by freshly allocated arrays, so the result never depends on the inputs after
 * it has been created.
 */
public final class GridDataset {

    /** Missing-value sentinel used unless a dataset declares another one. */
    public static final float DEFAULT_FILL_VALUE = Float.NaN;

    private final double[] lat;
    private final double[] lon;
    private final long[] time;
    private final float fillValue;
    private final Map<String, GridVariable> variables;
    private final Map<String, String> attributes;

    public GridDataset(double[] lat, double[] lon, long[] time, float fillValue,
                       Collection<GridVariable> variables, Map<String, String> attributes) {
        this.lat = Objects.requireNonNull(lat, "lat").clone();
        this.lon = Objects.requireNonNull(lon, "lon").clone();
        this.time = Objects.requireNonNull(time, "time").clone();
        if (lat.length == 0 || lon.length == 0) {
            throw new IllegalArgumentException("Dataset needs at least one lat and one lon coordinate");
        }
        this.fillValue = fillValue;
        Map<String, GridVariable> vars = new LinkedHashMap<>();
        for (GridVariable variable : variables) {
            if (variable.timeCount() != time.length || variable.latCount() != lat.length
                    || variable.lonCount() != lon.length) {
                throw new DimensionMismatchException("variable '" + variable.name() + "'",
                    "(" + time.length + ", " + lat.length + ", " + lon.length + ")",
                    "(" + variable.timeCount() + ", " + variable.latCount() + ", " + variable.lonCount() + ")");
            }
            if (vars.put(variable.name(), variable) != null) {
                throw new IllegalArgumentException("Duplicate variable '" + variable.name() + "'");
            }
        }
        this.variables = Collections.unmodifiableMap(vars);
        this.attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public GridExtent extent() {
        return new GridExtent(lat.length, lon.length);
    }

    public int timeCount() {
        return time.length;
    }

    public double[] lat() {
        return lat.clone();
    }

    public double[] lon() {
        return lon.clone();
    }

    public long[] time() {
        return time.clone();
    }

    public float fillValue() {
        return fillValue;
    }

    public Set<String> variableNames() {
        return variables.keySet();
    }

    public Collection<GridVariable> variables() {
        return variables.values();
    }

    public GridVariable variable(String name) {
        return variables.get(name);
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public GridDataset withAttributes(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(attributes);
        merged.putAll(extra);
        return new GridDataset(lat, lon, time, fillValue, variables.values(), merged);
    }

    /**
     * Returns a new dataset restricted to the tile's spatial window. All time steps are kept.
     */
    public GridDataset slice(TileSpec tile) {
        return slice(tile.latRange(), tile.lonRange());
    }

    public GridDataset slice(IndexRange latRange, IndexRange lonRange) {
        if (latRange.end() > lat.length || lonRange.end() > lon.length) {
            throw new DimensionMismatchException("dataset slice",
                "window within " + extent(), "lat" + latRange + " lon" + lonRange);
        }
        List<GridVariable> sliced = new ArrayList<>(variables.size());
        for (GridVariable variable : variables.values()) {
            sliced.add(variable.slice(latRange, lonRange));
        }
        return new GridDataset(
            Arrays.copyOfRange(lat, latRange.start(), latRange.end()),
            Arrays.copyOfRange(lon, lonRange.start(), lonRange.end()),
            time, fillValue, sliced, attributes);
    }

    /**
     * Concatenates datasets along one axis.
     * <p>
     * The other axes must have identical coordinates in every part, otherwise a
     * {@link DimensionMismatchException} is thrown. The result holds the union of all
     * variable names in first-seen order; a part that lacks a variable contributes the
     * fill value over its region. Attributes (global and per variable) are taken from
     * the first part that carries them.
     *
     * @param parts datasets in concatenation order, at least one
     * @param axis  axis to concatenate along
     * @return a new dataset owning all of its arrays
     */
    public static GridDataset concat(List<GridDataset> parts, Axis axis) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        GridDataset first = parts.get(0);
        for (GridDataset part : parts) {
            requireSameCoordinates(first, part, axis);
        }

        double[] outLat = axis == Axis.LAT ? joinDoubles(parts, GridDataset::lat) : first.lat;
        double[] outLon = axis == Axis.LON ? joinDoubles(parts, GridDataset::lon) : first.lon;
        long[] outTime = axis == Axis.TIME ? joinTimes(parts) : first.time;
        int nt = outTime.length;
        int nLat = outLat.length;
        int nLon = outLon.length;

        Set<String> names = new LinkedHashSet<>();
        for (GridDataset part : parts) {
            names.addAll(part.variableNames());
        }

        List<GridVariable> merged = new ArrayList<>(names.size());
        for (String name : names) {
            float[] out = new float[Math.multiplyExact(Math.multiplyExact(nt, nLat), nLon)];
            Map<String, String> varAttributes = null;
            int offset = 0;
            for (GridDataset part : parts) {
                GridVariable source = part.variable(name);
                if (source != null && varAttributes == null) {
                    varAttributes = source.attributes();
                }
                copyPart(source, part, axis, offset, out, nt, nLat, nLon, first.fillValue);
                offset += switch (axis) {
                    case TIME -> part.time.length;
                    case LAT -> part.lat.length;
                    case LON -> part.lon.length;
                };
            }
            merged.add(new GridVariable(name, nt, nLat, nLon, out, varAttributes));
        }

        Map<String, String> attrs = first.attributes;
        for (GridDataset part : parts) {
            if (!part.attributes.isEmpty()) {
                attrs = part.attributes;
                break;
            }
        }
        return new GridDataset(outLat, outLon, outTime, first.fillValue, merged, attrs);
    }

    private static void copyPart(GridVariable source, GridDataset part, Axis axis, int offset,
                                 float[] out, int nt, int nLat, int nLon, float fill) {
        int pt = part.time.length;
        int pLat = part.lat.length;
        int pLon = part.lon.length;
        for (int t = 0; t < pt; t++) {
            int ot = axis == Axis.TIME ? t + offset : t;
            for (int la = 0; la < pLat; la++) {
                int oLat = axis == Axis.LAT ? la + offset : la;
                int oLon = axis == Axis.LON ? offset : 0;
                int dest = (ot * nLat + oLat) * nLon + oLon;
                if (source != null) {
                    source.copyRow(t, la, 0, out, dest, pLon);
                } else {
                    Arrays.fill(out, dest, dest + pLon, fill);
                }
            }
        }
    }

    private static void requireSameCoordinates(GridDataset first, GridDataset part, Axis axis) {
        if (axis != Axis.TIME && !Arrays.equals(first.time, part.time)) {
            throw new DimensionMismatchException("concatenation along " + axis,
                first.time.length + " time steps " + describe(first.time),
                part.time.length + " time steps " + describe(part.time));
        }
        if (axis != Axis.LAT && !Arrays.equals(first.lat, part.lat)) {
            throw new DimensionMismatchException("concatenation along " + axis,
                first.lat.length + " lat coordinates", part.lat.length + " differing lat coordinates");
        }
        if (axis != Axis.LON && !Arrays.equals(first.lon, part.lon)) {
            throw new DimensionMismatchException("concatenation along " + axis,
                first.lon.length + " lon coordinates", part.lon.length + " differing lon coordinates");
        }
    }

    private static String describe(long[] values) {
        if (values.length == 0) {
            return "[]";
        }
        return "[" + values[0] + ".." + values[values.length - 1] + "]";
    }

    private interface DoubleAxis {
        double[] get(GridDataset dataset);
    }

    private static double[] joinDoubles(List<GridDataset> parts, DoubleAxis axis) {
        int total = 0;
        for (GridDataset part : parts) {
            total += axis.get(part).length;
        }
        double[] out = new double[total];
        int pos = 0;
        for (GridDataset part : parts) {
            double[] values = axis.get(part);
            System.arraycopy(values, 0, out, pos, values.length);
            pos += values.length;
        }
        return out;
    }

    private static long[] joinTimes(List<GridDataset> parts) {
        int total = 0;
        for (GridDataset part : parts) {
            total += part.time.length;
        }
        long[] out = new long[total];
        int pos = 0;
        for (GridDataset part : parts) {
            System.arraycopy(part.time, 0, out, pos, part.time.length);
            pos += part.time.length;
        }
        return out;
    }

    @Override
    public String toString() {
        return "GridDataset(time=" + time.length + ", lat=" + lat.length + ", lon=" + lon.length
            + ", variables=" + variables.keySet() + ")";
    }
}
