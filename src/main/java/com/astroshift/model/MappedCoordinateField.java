package com.astroshift.model;

/**
 * Integer pixel indices into a target raster, one per source pixel.
 * Positions without a valid mapping hold an index outside every raster
 * ({@link Integer#MIN_VALUE} or {@link Integer#MAX_VALUE}).
 */
public class MappedCoordinateField {

    public final int[][] x;
    public final int[][] y;
    public final RasterShape shape;

    public MappedCoordinateField(int[][] x, int[][] y) {
        this.shape = RasterShape.of(x);
        shape.requireSame("mapped field x", x);
        shape.requireSame("mapped field y", y);
        this.x = x;
        this.y = y;
    }
}
