package com.astroshift.service;

// sum(coeff[p][q] * u^p * v^q) con p + q <= order
public class SipPolynomial {

    private final int order;
    private final double[][] coeff;

    public SipPolynomial(int order, double[][] coeff) {
        if (order < 0) throw new IllegalArgumentException("SIP order must not be negative, got " + order);
        this.order = order;
        this.coeff = new double[order + 1][];
        for (int p = 0; p <= order; p++) {
            if (coeff.length != order + 1 || coeff[p].length != order + 1) {
                throw new IllegalArgumentException("SIP coefficient table must be " + (order + 1) + " x " + (order + 1));
            }
            this.coeff[p] = coeff[p].clone();
        }
    }

    public int getOrder() { return order; }

    public double coefficient(int p, int q) {
        return coeff[p][q];
    }

    public double evaluate(double u, double v) {
        double sum = 0;
        double up = 1;
        for (int p = 0; p <= order; p++) {
            double vq = 1;
            for (int q = 0; q <= order - p; q++) {
                sum += coeff[p][q] * up * vq;
                vq *= v;
            }
            up *= u;
        }
        return sum;
    }
}
