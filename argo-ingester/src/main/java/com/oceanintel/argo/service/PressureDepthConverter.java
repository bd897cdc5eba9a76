package com.oceanintel.argo.service;

/**
 * Sea pressure to depth, UNESCO 1983 (Fofonoff and Millard, technical paper 44).
 * Check value: 10000 dbar at 30 degrees latitude is 9712.653 m.
 */
public final class PressureDepthConverter {

    private PressureDepthConverter() {
    }

    /**
     * @param pressure sea pressure in decibar
     * @param latitude degrees, sign ignored
     * @return depth in metres, rounded to the millimetre so it is a stable key
     */
    public static double depth(double pressure, double latitude) {
        double x = Math.sin(Math.toRadians(latitude));
        x = x * x;
        double gravity = 9.780318 * (1.0 + (5.2788e-3 + 2.36e-5 * x) * x) + 1.092e-6 * pressure;
        double depth = ((((-1.82e-15 * pressure + 2.279e-10) * pressure - 2.2512e-5) * pressure + 9.72659) * pressure)
                / gravity;
        return Math.round(depth * 1000.0) / 1000.0;
    }
}
