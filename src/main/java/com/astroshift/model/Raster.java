package com.astroshift.model;

import java.util.Arrays;

public class Raster {

    private final double[][] data;
    private final RasterShape shape;

    public Raster(double[][] data) {
        this.shape = RasterShape.of(data);
        shape.requireSame("raster", data);
        this.data = copy(data);
    }

    public static Raster filled(RasterShape shape, double value) {
        double[][] d = new double[shape.height][shape.width];
        for (double[] row : d) Arrays.fill(row, value);
        return new Raster(d);
    }

    public RasterShape shape() { return shape; }

    public int height() { return shape.height; }

    public int width() { return shape.width; }

    public double get(int row, int col) {
        return data[row][col];
    }

    // Copia: el raster es inmutable
    public double[][] toArray() {
        return copy(data);
    }

    private static double[][] copy(double[][] src) {
        double[][] d = new double[src.length][];
        for (int i = 0; i < src.length; i++) d[i] = src[i].clone();
        return d;
    }
}
