package io.routeguide.geo;

import io.routeguide.proto.Point;
import io.routeguide.proto.Rectangle;

/**
 * Geometry over {@link Point} coordinates stored as degrees * 10^7.
 */
public class GeometryUtils {

    public static final double COORD_FACTOR = 1e7;

    //Earth radius in metres
    public static final int EARTH_RADIUS = 6371000;

    private GeometryUtils() {
    }

    public static double getLatitude(Point point) {
        return point.getLatitude() / COORD_FACTOR;
    }

    public static double getLongitude(Point point) {
        return point.getLongitude() / COORD_FACTOR;
    }

    /**
     * @return true if the point is inside the rectangle or on its boundary.
     * Either corner of the rectangle may be the lower one.
     */
    public static boolean containsPoint(Rectangle rect, Point point) {
        final Point lo = rect.getLo();
        final Point hi = rect.getHi();
        int left = Math.min(lo.getLongitude(), hi.getLongitude());
        int right = Math.max(lo.getLongitude(), hi.getLongitude());
        int top = Math.max(lo.getLatitude(), hi.getLatitude());
        int bottom = Math.min(lo.getLatitude(), hi.getLatitude());

        int lon = point.getLongitude();
        int lat = point.getLatitude();
        return lon >= left && lon <= right && lat >= bottom && lat <= top;
    }

    /**
     * @return a rectangle covering the same area with lo holding the minimum of each axis
     * and hi holding the maximum.
     */
    public static Rectangle normalize(Rectangle rect) {
        final Point lo = rect.getLo();
        final Point hi = rect.getHi();
        return Rectangle.newBuilder()
                .setLo(Point.newBuilder()
                        .setLatitude(Math.min(lo.getLatitude(), hi.getLatitude()))
                        .setLongitude(Math.min(lo.getLongitude(), hi.getLongitude())))
                .setHi(Point.newBuilder()
                        .setLatitude(Math.max(lo.getLatitude(), hi.getLatitude()))
                        .setLongitude(Math.max(lo.getLongitude(), hi.getLongitude())))
                .build();
    }

    /**
     * Great circle distance between two points using the haversine formula.
     * The result is truncated to whole metres.
     */
    public static int distanceMeters(Point start, Point end) {
        double lat1 = Math.toRadians(getLatitude(start));
        double lat2 = Math.toRadians(getLatitude(end));
        double lon1 = Math.toRadians(getLongitude(start));
        double lon2 = Math.toRadians(getLongitude(end));
        double deltaLat = lat2 - lat1;
        double deltaLon = lon2 - lon1;

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return (int) (EARTH_RADIUS * c);
    }

    public static boolean samePoint(Point p1, Point p2) {
        return p1.getLatitude() == p2.getLatitude() && p1.getLongitude() == p2.getLongitude();
    }

    public static String format(Point point) {
        return "(" + getLatitude(point) + ", " + getLongitude(point) + ")";
    }
}
