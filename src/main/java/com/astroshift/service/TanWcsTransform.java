package com.astroshift.service;

import com.astroshift.model.CelestialPoint;
import com.astroshift.model.PixelCoordinateField;
import com.astroshift.model.PixelOrigin;
import com.astroshift.model.RasterShape;
import com.astroshift.model.SkyCoordinateField;

/**
 * Gnomonic (TAN) world coordinate system with optional SIP distortion.
 * <p>
 * Pixel to sky: offset from CRPIX, SIP forward polynomials, CD matrix to intermediate
 * world coordinates, TAN de-projection to native spherical coordinates, rotation to
 * celestial (RA, Dec) about CRVAL.
 * Sky to pixel runs the same chain backwards. The SIP inverse uses AP/BP when present
 * as a starting point and refines it by fixed-point iteration on the forward polynomials.
 * Points more than 90 degrees from CRVAL have no TAN projection and map to NaN.
 */
public class TanWcsTransform implements AstrometricTransform {

    static final int MAX_SIP_ITERATIONS = 20;
    static final double SIP_TOLERANCE = 1e-8;

    private static final double R2D = 180.0 / Math.PI;

    private final double crval1, crval2;
    private final double crpix1, crpix2;
    private final double cd11, cd12, cd21, cd22;
    private final double inv11, inv12, inv21, inv22;
    private final double lonpole;

    private final SipPolynomial a, b;   // null sin distorsión
    private final SipPolynomial ap, bp;

    // Precalculados para la rotación esférica
    private final double sinDecP, cosDecP;
    private final double sinPhiP, cosPhiP;

    public TanWcsTransform(CelestialPoint crval, double crpix1, double crpix2, double[][] cd) {
        this(crval, crpix1, crpix2, cd, defaultLonpole(crval.dec), null, null, null, null);
    }

    public TanWcsTransform(CelestialPoint crval, double crpix1, double crpix2, double[][] cd, double lonpole,
                           SipPolynomial a, SipPolynomial b, SipPolynomial ap, SipPolynomial bp) {
        if ((a == null) != (b == null)) {
            throw new IllegalArgumentException("SIP distortion needs both A and B polynomials");
        }
        if ((ap == null) != (bp == null)) {
            throw new IllegalArgumentException("SIP inverse needs both AP and BP polynomials");
        }
        this.crval1 = crval.ra;
        this.crval2 = crval.dec;
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd[0][0];
        this.cd12 = cd[0][1];
        this.cd21 = cd[1][0];
        this.cd22 = cd[1][1];

        double det = cd11 * cd22 - cd12 * cd21;
        if (Math.abs(det) < 1.0E-20 || Double.isNaN(det)) {
            throw new IllegalArgumentException("WCS linear transformation matrix is singular (det=" + det + ")");
        }
        this.inv11 = cd22 / det;
        this.inv12 = -cd12 / det;
        this.inv21 = -cd21 / det;
        this.inv22 = cd11 / det;

        this.lonpole = lonpole;
        this.a = a;
        this.b = b;
        this.ap = ap;
        this.bp = bp;

        this.sinDecP = Math.sin(Math.toRadians(crval2));
        this.cosDecP = Math.cos(Math.toRadians(crval2));
        this.sinPhiP = Math.sin(Math.toRadians(lonpole));
        this.cosPhiP = Math.cos(Math.toRadians(lonpole));
    }

    // Proyecciones cenitales: latitud nativa de referencia 90°
    static double defaultLonpole(double crval2) {
        return crval2 >= 90.0 ? 0.0 : 180.0;
    }

    public CelestialPoint getReferencePoint() { return new CelestialPoint(crval1, crval2); }

    public double getCrpix1() { return crpix1; }

    public double getCrpix2() { return crpix2; }

    public double[][] getCdMatrix() { return new double[][] {{cd11, cd12}, {cd21, cd22}}; }

    public double getLonpole() { return lonpole; }

    public boolean hasDistortion() { return a != null; }

    @Override
    public CelestialPoint pixelToSky(double x, double y, PixelOrigin origin) {
        // CRPIX está en convención FITS (1-based)
        double u = x + (1 - origin.offset) - crpix1;
        double v = y + (1 - origin.offset) - crpix2;

        if (a != null) {
            double du = a.evaluate(u, v);
            double dv = b.evaluate(u, v);
            u += du;
            v += dv;
        }

        double ix = cd11 * u + cd12 * v;
        double iy = cd21 * u + cd22 * v;

        // Cosenos directores nativos: s = cos(theta) sin(phi - phiP), c = cos(theta) cos(phi - phiP)
        double rho = Math.hypot(R2D, Math.hypot(ix, iy));
        double sinTheta = R2D / rho;
        double s = (ix * cosPhiP + iy * sinPhiP) / rho;
        double c = (ix * sinPhiP - iy * cosPhiP) / rho;

        double num = -s;
        double den = sinTheta * cosDecP - c * sinDecP;
        double ra = crval1 + Math.toDegrees(Math.atan2(num, den));
        double dec = Math.toDegrees(Math.atan2(sinTheta * sinDecP + c * cosDecP, Math.hypot(num, den)));

        return new CelestialPoint(normalizeRa(ra), dec);
    }

    @Override
    public double[] skyToPixel(double ra, double dec, PixelOrigin origin) {
        double dra = Math.toRadians(ra - crval1);
        double d = Math.toRadians(dec);
        double sinDec = Math.sin(d), cosDec = Math.cos(d);

        double cosDra = Math.cos(dra);
        double s = -cosDec * Math.sin(dra);
        double c = sinDec * cosDecP - cosDec * sinDecP * cosDra;
        double sinTheta = sinDec * sinDecP + cosDec * cosDecP * cosDra;

        // Detrás del plano tangente: sin solución
        if (!(sinTheta > 0)) {
            return new double[] {Double.NaN, Double.NaN};
        }
        double ix = R2D * (s * cosPhiP + c * sinPhiP) / sinTheta;
        double iy = -R2D * (c * cosPhiP - s * sinPhiP) / sinTheta;

        double u = inv11 * ix + inv12 * iy;
        double v = inv21 * ix + inv22 * iy;

        if (a != null) {
            double[] uv = removeDistortion(u, v);
            u = uv[0];
            v = uv[1];
        }

        return new double[] {u + crpix1 - (1 - origin.offset), v + crpix2 - (1 - origin.offset)};
    }

    /**
     * Solves {@code (u + A(u,v), v + B(u,v)) = (uTarget, vTarget)} for (u, v).
     */
    double[] removeDistortion(double uTarget, double vTarget) {
        double u = uTarget, v = vTarget;
        if (ap != null) {
            u = uTarget + ap.evaluate(uTarget, vTarget);
            v = vTarget + bp.evaluate(uTarget, vTarget);
        }
        for (int i = 0; i < MAX_SIP_ITERATIONS; i++) {
            double nu = uTarget - a.evaluate(u, v);
            double nv = vTarget - b.evaluate(u, v);
            double delta = Math.max(Math.abs(nu - u), Math.abs(nv - v));
            u = nu;
            v = nv;
            if (delta < SIP_TOLERANCE) break;
        }
        return new double[] {u, v};
    }

    @Override
    public SkyCoordinateField pixelToSky(double[][] x, double[][] y, PixelOrigin origin) {
        RasterShape shape = RasterShape.of(x);
        shape.requireSame("pixelToSky x", x);
        shape.requireSame("pixelToSky y", y);

        double[][] ra = new double[shape.height][shape.width];
        double[][] dec = new double[shape.height][shape.width];
        for (int r = 0; r < shape.height; r++) {
            for (int c = 0; c < shape.width; c++) {
                CelestialPoint p = pixelToSky(x[r][c], y[r][c], origin);
                ra[r][c] = p.ra;
                dec[r][c] = p.dec;
            }
        }
        return new SkyCoordinateField(ra, dec);
    }

    @Override
    public PixelCoordinateField skyToPixel(double[][] ra, double[][] dec, PixelOrigin origin) {
        RasterShape shape = RasterShape.of(ra);
        shape.requireSame("skyToPixel ra", ra);
        shape.requireSame("skyToPixel dec", dec);

        double[][] x = new double[shape.height][shape.width];
        double[][] y = new double[shape.height][shape.width];
        for (int r = 0; r < shape.height; r++) {
            for (int c = 0; c < shape.width; c++) {
                double[] p = skyToPixel(ra[r][c], dec[r][c], origin);
                x[r][c] = p[0];
                y[r][c] = p[1];
            }
        }
        return new PixelCoordinateField(x, y);
    }

    private static double normalizeRa(double ra) {
        double n = ra % 360.0;
        return n < 0 ? n + 360.0 : n;
    }

    @Override
    public String toString() {
        return "TanWcsTransform{crval=(" + crval1 + ", " + crval2 + "), crpix=(" + crpix1 + ", " + crpix2 +
               "), cd=[[" + cd11 + ", " + cd12 + "], [" + cd21 + ", " + cd22 + "]], sip=" + hasDistortion() + "}";
    }
}
