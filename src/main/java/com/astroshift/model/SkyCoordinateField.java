package com.astroshift.model;

public class SkyCoordinateField {

    public final double[][] ra;
    public final double[][] dec;
    public final RasterShape shape;

    public SkyCoordinateField(double[][] ra, double[][] dec) {
        this.shape = RasterShape.of(ra);
        shape.requireSame("sky field ra", ra);
        shape.requireSame("sky field dec", dec);
        this.ra = ra;
        this.dec = dec;
    }
}
