package com.astroshift.model;

// Puede contener NaN o infinitos donde la transformación no tiene solución
public class PixelCoordinateField {

    public final double[][] x;
    public final double[][] y;
    public final RasterShape shape;

    public PixelCoordinateField(double[][] x, double[][] y) {
        this.shape = RasterShape.of(x);
        shape.requireSame("pixel field x", x);
        shape.requireSame("pixel field y", y);
        this.x = x;
        this.y = y;
    }
}
