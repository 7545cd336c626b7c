package com.astroshift.service;

import com.astroshift.model.CelestialPoint;
import com.astroshift.model.PixelCoordinateField;
import com.astroshift.model.PixelOrigin;
import com.astroshift.model.ShapeMismatchException;
import com.astroshift.model.SkyCoordinateField;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TanWcsTransform} class.
 */
public class TanWcsTransformTest {

    @Test
    public void testReferencePixelMapsToReferencePoint() {
        final TanWcsTransform wcs = WcsFixtures.tan(10.0, 20.0);

        final CelestialPoint zeroBased = wcs.pixelToSky(9.0, 19.0, PixelOrigin.ZERO);
        Assert.assertEquals("invalid ra", WcsFixtures.CRVAL1, zeroBased.ra, 1e-10);
        Assert.assertEquals("invalid dec", WcsFixtures.CRVAL2, zeroBased.dec, 1e-10);

        final CelestialPoint oneBased = wcs.pixelToSky(10.0, 20.0, PixelOrigin.ONE);
        Assert.assertEquals("invalid ra", WcsFixtures.CRVAL1, oneBased.ra, 1e-10);
        Assert.assertEquals("invalid dec", WcsFixtures.CRVAL2, oneBased.dec, 1e-10);
    }

    @Test
    public void testAxisOrientation() {
        final TanWcsTransform wcs = WcsFixtures.tan(1.0, 1.0);
        final CelestialPoint origin = wcs.pixelToSky(0, 0, PixelOrigin.ZERO);
        final CelestialPoint right = wcs.pixelToSky(100, 0, PixelOrigin.ZERO);
        final CelestialPoint up = wcs.pixelToSky(0, 100, PixelOrigin.ZERO);

        Assert.assertTrue("ra should decrease to the right", right.ra < origin.ra);
        Assert.assertTrue("dec should increase upwards", up.dec > origin.dec);
        // 100 px * 1e-4 deg, corregido por cos(dec)
        Assert.assertEquals("invalid ra step", 0.01 / Math.cos(Math.toRadians(WcsFixtures.CRVAL2)),
                            origin.ra - right.ra, 1e-6);
        Assert.assertEquals("invalid dec step", 0.01, up.dec - origin.dec, 1e-6);
    }

    @Test
    public void testPixelSkyPixelRoundTrip() {
        final TanWcsTransform wcs = new TanWcsTransform(new CelestialPoint(359.99, -45.0), 512.5, 300.25,
                                                        new double[][] {{-2.1e-4, 3.0e-5}, {2.5e-5, 2.0e-4}});
        for (int y = -200; y <= 1200; y += 175) {
            for (int x = -100; x <= 1100; x += 150) {
                final CelestialPoint sky = wcs.pixelToSky(x, y, PixelOrigin.ZERO);
                final double[] back = wcs.skyToPixel(sky.ra, sky.dec, PixelOrigin.ZERO);
                Assert.assertEquals("x round trip at " + x + "," + y, x, back[0], 1e-7);
                Assert.assertEquals("y round trip at " + x + "," + y, y, back[1], 1e-7);
                Assert.assertTrue("ra must be normalized", sky.ra >= 0 && sky.ra < 360);
            }
        }
    }

    @Test
    public void testPointBehindTangentPlaneHasNoSolution() {
        final TanWcsTransform wcs = new TanWcsTransform(new CelestialPoint(10.0, 0.0), 1, 1,
                                                        new double[][] {{-1e-3, 0}, {0, 1e-3}});
        final double[] opposite = wcs.skyToPixel(190.0, 0.0, PixelOrigin.ZERO);
        Assert.assertTrue("opposite point should be NaN", Double.isNaN(opposite[0]) && Double.isNaN(opposite[1]));

        final double[] horizon = wcs.skyToPixel(100.5, 0.0, PixelOrigin.ZERO);
        Assert.assertTrue("point beyond 90 degrees should be NaN", Double.isNaN(horizon[0]));

        final double[] nan = wcs.skyToPixel(Double.NaN, 0.0, PixelOrigin.ZERO);
        Assert.assertTrue("NaN input should give NaN", Double.isNaN(nan[0]));
    }

    @Test
    public void testSipDistortionRoundTrip() {
        final double[][] aCoeff = new double[3][3];
        final double[][] bCoeff = new double[3][3];
        aCoeff[2][0] = 2.0e-5;
        aCoeff[1][1] = -1.0e-5;
        bCoeff[0][2] = 1.5e-5;
        final SipPolynomial a = new SipPolynomial(2, aCoeff);
        final SipPolynomial b = new SipPolynomial(2, bCoeff);

        final TanWcsTransform wcs = new TanWcsTransform(new CelestialPoint(150, 2), 200, 150,
                                                        new double[][] {{-1e-4, 0}, {0, 1e-4}},
                                                        180.0, a, b, null, null);
        final TanWcsTransform plain = WcsFixtures.tan(200, 150);

        Assert.assertTrue("distortion expected", wcs.hasDistortion());

        final CelestialPoint distorted = wcs.pixelToSky(380, 10, PixelOrigin.ZERO);
        final CelestialPoint undistorted = plain.pixelToSky(380, 10, PixelOrigin.ZERO);
        Assert.assertNotEquals("SIP should move the corner", undistorted.ra, distorted.ra, 1e-7);

        for (int y = 0; y <= 300; y += 60) {
            for (int x = 0; x <= 400; x += 80) {
                final CelestialPoint sky = wcs.pixelToSky(x, y, PixelOrigin.ZERO);
                final double[] back = wcs.skyToPixel(sky.ra, sky.dec, PixelOrigin.ZERO);
                Assert.assertEquals("x round trip at " + x + "," + y, x, back[0], 1e-6);
                Assert.assertEquals("y round trip at " + x + "," + y, y, back[1], 1e-6);
            }
        }
    }

    @Test
    public void testArrayConversionMatchesSinglePoint() {
        final TanWcsTransform wcs = WcsFixtures.tan(2, 2);
        final double[][] x = {{0, 1, 2}, {3, 4, 5}};
        final double[][] y = {{0, 0, 0}, {1, 1, 1}};

        final SkyCoordinateField sky = wcs.pixelToSky(x, y, PixelOrigin.ZERO);
        final PixelCoordinateField pixels = wcs.skyToPixel(sky.ra, sky.dec, PixelOrigin.ZERO);

        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 3; c++) {
                final CelestialPoint p = wcs.pixelToSky(x[r][c], y[r][c], PixelOrigin.ZERO);
                Assert.assertEquals("ra[" + r + "," + c + "]", p.ra, sky.ra[r][c], 0.0);
                Assert.assertEquals("dec[" + r + "," + c + "]", p.dec, sky.dec[r][c], 0.0);
                Assert.assertEquals("x[" + r + "," + c + "]", x[r][c], pixels.x[r][c], 1e-8);
                Assert.assertEquals("y[" + r + "," + c + "]", y[r][c], pixels.y[r][c], 1e-8);
            }
        }
    }

    @Test(expected = ShapeMismatchException.class)
    public void testMismatchedArraysRejected() {
        WcsFixtures.tan(1, 1).pixelToSky(new double[2][3], new double[3][2], PixelOrigin.ZERO);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSingularMatrixRejected() {
        new TanWcsTransform(new CelestialPoint(0, 0), 1, 1, new double[][] {{1e-4, 2e-4}, {1e-4, 2e-4}});
    }

    @Test
    public void testDefaultLonpole() {
        Assert.assertEquals("lonpole away from the pole", 180.0, TanWcsTransform.defaultLonpole(45.0), 0.0);
        Assert.assertEquals("lonpole at the pole", 0.0, TanWcsTransform.defaultLonpole(90.0), 0.0);
    }
}
