package com.wom.openings.util;

import com.wom.openings.model.GeoPoint;

public final class GeoMath {
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMath() {}

    /** Great-circle distance in kilometres (haversine). */
    public static double haversineKm(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.lat());
        double phi2 = Math.toRadians(b.lat());
        double dPhi = Math.toRadians(b.lat() - a.lat());
        double dLambda = Math.toRadians(b.lon() - a.lon());
        double h = Math.pow(Math.sin(dPhi / 2), 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.pow(Math.sin(dLambda / 2), 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }

    /** Inclusive: a point exactly at {@code radiusKm} is inside. */
    public static boolean withinRadius(GeoPoint center, GeoPoint point, double radiusKm) {
        return haversineKm(center, point) <= radiusKm;
    }
}
