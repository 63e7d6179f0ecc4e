package org.timberline.pipeline.api.reference;

/**
 * Shape of a stored reference surface and how it is split into day blocks.
 *
 * @param name         surface name
 * @param dayCount     calendar days (1 for surfaces without a calendar dimension)
 * @param latCount     latitude cells
 * @param lonCount     longitude cells
 * @param daysPerBlock calendar days per stored block
 * @param units        units attribute, may be null
 */
public record SurfaceLayout(String name, int dayCount, int latCount, int lonCount, int daysPerBlock, String units) {

    public SurfaceLayout {
        if (dayCount <= 0 || latCount <= 0 || lonCount <= 0 || daysPerBlock <= 0) {
            throw new IllegalArgumentException("Invalid layout for reference surface '" + name + "'");
        }
    }

    public int blockCount() {
        return (dayCount + daysPerBlock - 1) / daysPerBlock;
    }

    public int blockOf(int day) {
        return day / daysPerBlock;
    }

    public int firstDayOf(int block) {
        return block * daysPerBlock;
    }

    public int daysInBlock(int block) {
        return Math.min(daysPerBlock, dayCount - firstDayOf(block));
    }
}
