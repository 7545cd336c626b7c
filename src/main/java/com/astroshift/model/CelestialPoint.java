package com.astroshift.model;

import java.util.Locale;

public class CelestialPoint {
    public final double ra;  // grados
    public final double dec; // grados

    public CelestialPoint(double ra, double dec) {
        this.ra = ra;
        this.dec = dec;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(RA %.6f, DEC %.6f)", ra, dec);
    }
}
