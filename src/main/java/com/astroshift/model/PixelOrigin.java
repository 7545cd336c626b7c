package com.astroshift.model;

// 0 = índices Java; 1 = convención FITS/DS9/IRAF
public enum PixelOrigin {
    ZERO(0), ONE(1);

    public final int offset;

    PixelOrigin(int offset) {
        this.offset = offset;
    }

    public static PixelOrigin of(int offset) {
        for (PixelOrigin o : values()) {
            if (o.offset == offset) return o;
        }
        throw new IllegalArgumentException("pixel origin must be 0 or 1, got " + offset);
    }
}
