package com.polarroute.shared.util;

import com.uber.h3core.H3Core;

import java.io.IOException;

/**
 * Geo helpers shared by the route services.
 * H3 cells bucket waypoints for advisory locking; resolution 5 ≈ 252 km², coarse enough that
 * requests inside the usual waypoint tolerance land in the same or an adjacent cell.
 */
public final class H3Util {

    public static final int LOCK_RESOLUTION = 5;

    /** Mean earth radius (IUGG). */
    public static final double EARTH_RADIUS_KM = 6371.0088;
    public static final double KM_TO_NAUTICAL_MILES = 0.539956803;

    private static final H3Core h3;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
    }

    private H3Util() {}

    public static String latLngToCell(double lat, double lng, int resolution) {
        return h3.latLngToCellAddress(lat, lng, resolution);
    }

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceNauticalMiles(double lat1, double lng1, double lat2, double lng2) {
        return distanceKm(lat1, lng1, lat2, lng2) * KM_TO_NAUTICAL_MILES;
    }
}
