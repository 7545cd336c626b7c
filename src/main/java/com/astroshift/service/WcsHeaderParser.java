package com.astroshift.service;

import com.astroshift.model.CelestialPoint;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Matriz lineal: CDi_j, si no PCi_j * CDELTi, si no CDELTi rotado por CROTA2
public class WcsHeaderParser {

    public TanWcsTransform parse(Header header) throws IllegalArgumentException {
        checkProjection(header, "CTYPE1", "RA");
        checkProjection(header, "CTYPE2", "DEC");

        double crval1 = require(header, "CRVAL1");
        double crval2 = require(header, "CRVAL2");
        double crpix1 = require(header, "CRPIX1");
        double crpix2 = require(header, "CRPIX2");

        double[][] cd = readLinearMatrix(header);
        double lonpole = header.containsKey("LONPOLE")
                         ? header.getDoubleValue("LONPOLE", 180.0)
                         : TanWcsTransform.defaultLonpole(crval2);

        SipPolynomial a = readSip(header, "A");
        SipPolynomial b = readSip(header, "B");
        SipPolynomial ap = readSip(header, "AP");
        SipPolynomial bp = readSip(header, "BP");

        TanWcsTransform wcs = new TanWcsTransform(new CelestialPoint(crval1, crval2), crpix1, crpix2, cd, lonpole,
                                                  a, b, ap, bp);
        LOG.debug("parse: built {}", wcs);
        return wcs;
    }

    private void checkProjection(Header header, String key, String axis) {
        String ctype = header.getStringValue(key);
        if (ctype == null) {
            LOG.warn("checkProjection: {} missing, assuming {} TAN projection", key, axis);
            return;
        }
        String t = ctype.trim().toUpperCase();
        // p.ej. "RA---TAN", "DEC--TAN", "RA---TAN-SIP"
        if (!t.startsWith(axis) || !(t.endsWith("-TAN") || t.endsWith("-TAN-SIP"))) {
            throw new IllegalArgumentException("unsupported projection " + key + "='" + ctype +
                                               "', only " + axis + " TAN (optionally with SIP) is supported");
        }
    }

    double[][] readLinearMatrix(Header header) {
        if (header.containsKey("CD1_1") || header.containsKey("CD1_2") ||
            header.containsKey("CD2_1") || header.containsKey("CD2_2")) {
            return new double[][] {
                    {header.getDoubleValue("CD1_1", 0), header.getDoubleValue("CD1_2", 0)},
                    {header.getDoubleValue("CD2_1", 0), header.getDoubleValue("CD2_2", 0)}
            };
        }

        double cdelt1 = require(header, "CDELT1");
        double cdelt2 = require(header, "CDELT2");

        if (header.containsKey("PC1_1") || header.containsKey("PC1_2") ||
            header.containsKey("PC2_1") || header.containsKey("PC2_2")) {
            return new double[][] {
                    {cdelt1 * header.getDoubleValue("PC1_1", 1), cdelt1 * header.getDoubleValue("PC1_2", 0)},
                    {cdelt2 * header.getDoubleValue("PC2_1", 0), cdelt2 * header.getDoubleValue("PC2_2", 1)}
            };
        }

        double rho = Math.toRadians(header.getDoubleValue("CROTA2", 0));
        return new double[][] {
                {cdelt1 * Math.cos(rho), -cdelt2 * Math.sin(rho)},
                {cdelt1 * Math.sin(rho), cdelt2 * Math.cos(rho)}
        };
    }

    SipPolynomial readSip(Header header, String prefix) {
        String orderKey = prefix + "_ORDER";
        if (!header.containsKey(orderKey)) return null;

        int order = header.getIntValue(orderKey, 0);
        double[][] coeff = new double[order + 1][order + 1];
        for (int p = 0; p <= order; p++) {
            for (int q = 0; q <= order - p; q++) {
                coeff[p][q] = header.getDoubleValue(prefix + "_" + p + "_" + q, 0);
            }
        }
        return new SipPolynomial(order, coeff);
    }

    private static double require(Header header, String key) {
        if (!header.containsKey(key)) {
            throw new IllegalArgumentException("FITS header is missing WCS keyword " + key);
        }
        return header.getDoubleValue(key, Double.NaN);
    }

    private static final Logger LOG = LoggerFactory.getLogger(WcsHeaderParser.class);
}
