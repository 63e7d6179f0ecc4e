package org.timberline.pipeline.api.reference;

import java.util.Objects;

import org.timberline.pipeline.api.grid.IndexRange;
import org.timberline.pipeline.api.tiling.DimensionMismatchException;

/**
 * Read-only auxiliary array keyed by {@code (calendar_day, lat, lon)}, for example a
 * day-of-year percentile threshold. Surfaces without a calendar dimension have a day
 * count of one.
 * <p>
 * The value array is never exposed; {@link #subset} returns a new surface backed by
 * its own copy, so tile-local surfaces never alias the shared one.
 */
public final class ReferenceSurface {

    private final String name;
    private final int dayCount;
    private final int latCount;
    private final int lonCount;
    private final float[] values;
    private final String units;

    public ReferenceSurface(String name, int dayCount, int latCount, int lonCount, float[] values, String units) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = Objects.requireNonNull(values, "values");
        if (dayCount <= 0 || latCount <= 0 || lonCount <= 0) {
            throw new IllegalArgumentException("Invalid shape for reference surface '" + name + "'");
        }
        if (values.length != (long) dayCount * latCount * lonCount) {
            throw new DimensionMismatchException("reference surface '" + name + "'",
                ((long) dayCount * latCount * lonCount) + " values", values.length + " values");
        }
        this.dayCount = dayCount;
        this.latCount = latCount;
        this.lonCount = lonCount;
        this.units = units;
    }

    public String name() {
        return name;
    }

    public int dayCount() {
        return dayCount;
    }

    public int latCount() {
        return latCount;
    }

    public int lonCount() {
        return lonCount;
    }

    public String units() {
        return units;
    }

    public boolean isDayOfYearIndexed() {
        return dayCount > 1;
    }

    public float get(int day, int lat, int lon) {
        return values[(day * latCount + lat) * lonCount + lon];
    }

    /**
     * Returns the threshold for a zero-based day of year, clamping days beyond the
     * surface's calendar (day 366 against a 365-day surface) to its last day.
     */
    public float forDayOfYear(int dayOfYearIndex, int lat, int lon) {
        int day = isDayOfYearIndexed() ? Math.min(Math.max(dayOfYearIndex, 0), dayCount - 1) : 0;
        return get(day, lat, lon);
    }

    /**
     * Pure spatial subset: returns a new surface for the window, leaving this one untouched.
     */
    public ReferenceSurface subset(IndexRange latRange, IndexRange lonRange) {
        if (latRange.end() > latCount || lonRange.end() > lonCount) {
            throw new DimensionMismatchException("subset of reference surface '" + name + "'",
                "window within " + latCount + "x" + lonCount, "lat" + latRange + " lon" + lonRange);
        }
        int outLat = latRange.length();
        int outLon = lonRange.length();
        float[] out = new float[dayCount * outLat * outLon];
        for (int d = 0; d < dayCount; d++) {
            for (int la = 0; la < outLat; la++) {
                int src = (d * latCount + latRange.start() + la) * lonCount + lonRange.start();
                System.arraycopy(values, src, out, (d * outLat + la) * outLon, outLon);
            }
        }
        return new ReferenceSurface(name, dayCount, outLat, outLon, out, units);
    }

    /**
     * Copies one day's {@code (lat, lon)} window into {@code dest} at the given day slot.
     * Used to assemble tile-local surfaces from cached day blocks.
     */
    public void copyWindow(int day, IndexRange latRange, IndexRange lonRange, float[] dest, int destDay) {
        int outLat = latRange.length();
        int outLon = lonRange.length();
        for (int la = 0; la < outLat; la++) {
            int src = (day * latCount + latRange.start() + la) * lonCount + lonRange.start();
            System.arraycopy(values, src, dest, (destDay * outLat + la) * outLon, outLon);
        }
    }

    @Override
    public String toString() {
        return name + "(" + dayCount + ", " + latCount + ", " + lonCount + ")";
    }
}
