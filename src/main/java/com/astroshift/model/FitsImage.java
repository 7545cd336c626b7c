package com.astroshift.model;

import nom.tam.fits.Header;

public class FitsImage {
    public final Raster raster;
    public final Header header;

    public FitsImage(Raster raster, Header header) {
        this.raster = raster;
        this.header = header;
    }
}
