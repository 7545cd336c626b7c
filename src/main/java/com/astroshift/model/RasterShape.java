package com.astroshift.model;

public class RasterShape {

    public final int height;
    public final int width;

    public RasterShape(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("raster dimensions must be positive, got height=" + height +
                                               ", width=" + width);
        }
        this.height = height;
        this.width = width;
    }

    public static RasterShape of(double[][] data) {
        return new RasterShape(data.length, data.length == 0 ? 0 : data[0].length);
    }

    public static RasterShape of(int[][] data) {
        return new RasterShape(data.length, data.length == 0 ? 0 : data[0].length);
    }

    public int pixelCount() {
        return height * width;
    }

    public void requireSame(String stage, double[][] data) throws ShapeMismatchException {
        if (data == null || data.length != height) {
            throw new ShapeMismatchException(stage, this, data == null ? "null" : data.length + " rows");
        }
        for (double[] row : data) {
            if (row == null || row.length != width) {
                throw new ShapeMismatchException(stage, this, "row of " + (row == null ? "null" : row.length));
            }
        }
    }

    public void requireSame(String stage, int[][] data) throws ShapeMismatchException {
        if (data == null || data.length != height) {
            throw new ShapeMismatchException(stage, this, data == null ? "null" : data.length + " rows");
        }
        for (int[] row : data) {
            if (row == null || row.length != width) {
                throw new ShapeMismatchException(stage, this, "row of " + (row == null ? "null" : row.length));
            }
        }
    }

    public void requireSame(String stage, RasterShape other) throws ShapeMismatchException {
        if (!equals(other)) {
            throw new ShapeMismatchException(stage, this, String.valueOf(other));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterShape)) return false;
        RasterShape that = (RasterShape) o;
        return height == that.height && width == that.width;
    }

    @Override
    public int hashCode() {
        return 31 * height + width;
    }

    @Override
    public String toString() {
        return "(" + height + ", " + width + ")";
    }
}
