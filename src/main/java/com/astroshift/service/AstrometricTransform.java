package com.astroshift.service;

import com.astroshift.model.CelestialPoint;
import com.astroshift.model.PixelCoordinateField;
import com.astroshift.model.PixelOrigin;
import com.astroshift.model.SkyCoordinateField;

// Coordenadas de cielo en grados; sin solución devuelve NaN
public interface AstrometricTransform {

    CelestialPoint pixelToSky(double x, double y, PixelOrigin origin);

    // {x, y} en píxeles fraccionarios
    double[] skyToPixel(double ra, double dec, PixelOrigin origin);

    SkyCoordinateField pixelToSky(double[][] x, double[][] y, PixelOrigin origin);

    PixelCoordinateField skyToPixel(double[][] ra, double[][] dec, PixelOrigin origin);
}
