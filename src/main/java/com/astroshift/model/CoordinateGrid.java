package com.astroshift.model;

public class CoordinateGrid {

    public final int[][] x;
    public final int[][] y;
    public final RasterShape shape;

    public CoordinateGrid(int[][] x, int[][] y) {
        this.shape = RasterShape.of(x);
        shape.requireSame("coordinate grid x", x);
        shape.requireSame("coordinate grid y", y);
        this.x = x;
        this.y = y;
    }

    public double[][] xAsDouble() { return toDouble(x); }

    public double[][] yAsDouble() { return toDouble(y); }

    private static double[][] toDouble(int[][] k) {
        double[][] d = new double[k.length][k[0].length];
        for (int i = 0; i < k.length; i++) for (int j = 0; j < k[0].length; j++) d[i][j] = k[i][j];
        return d;
    }
}
