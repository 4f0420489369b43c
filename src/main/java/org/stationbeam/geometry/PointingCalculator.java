package org.stationbeam.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.stationbeam.data.CelestialDirection;
import org.stationbeam.data.StationGeometry;
import org.stationbeam.exceptions.CoordinateTransformException;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Celestial to station-frame conversion for a tracked direction. Precession,
 * nutation and polar motion are ignored; UT1 is taken as UTC.
 */
public class PointingCalculator {
    private static final Set<String> SUPPORTED_FRAMES = Set.of("J2000", "ICRS");

    private static final double WGS84_A = 6378137.0;
    private static final double WGS84_F = 1 / 298.257223563;
    private static final double WGS84_E2 = WGS84_F * (2 - WGS84_F);
    private static final int GEODETIC_ITERATIONS = 6;

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double J2000_JD = 2451545.0;

    public StationPointing compute(StationGeometry geometry, Instant time, CelestialDirection direction) {
        checkDirection(direction);
        final var rotation = geometry.getRotation();
        if (!rotation.isSquare(3)) {
            throw new CoordinateTransformException("Alignment matrix of " + geometry.getStation() + " is "
                    + rotation.getRows() + "x" + rotation.getColumns() + ", expected 3x3");
        }

        final var position = geometry.getPosition();
        final var p = Math.hypot(position.getX(), position.getY());
        if (p == 0 && position.getZ() == 0) {
            throw new CoordinateTransformException("Station " + geometry.getStation() + " is at the geocentre");
        }
        final var longitude = Math.atan2(position.getY(), position.getX());
        final var latitude = geodeticLatitude(p, position.getZ());

        final var gmst = greenwichMeanSiderealTime(time);
        final var ra = direction.getRightAscension();
        final var dec = direction.getDeclination();
        final var source = new Vector3D(
                Math.cos(dec) * Math.cos(ra - gmst),
                Math.cos(dec) * Math.sin(ra - gmst),
                Math.sin(dec));

        final var east = new Vector3D(-Math.sin(longitude), Math.cos(longitude), 0);
        final var north = new Vector3D(-Math.sin(latitude) * Math.cos(longitude),
                -Math.sin(latitude) * Math.sin(longitude), Math.cos(latitude));
        final var up = new Vector3D(Math.cos(latitude) * Math.cos(longitude),
                Math.cos(latitude) * Math.sin(longitude), Math.sin(latitude));

        final var elevation = Math.asin(clamp(source.dotProduct(up)));
        final var azimuth = normalize(Math.atan2(source.dotProduct(east), source.dotProduct(north)));

        final var hourAngle = gmst + longitude - ra;
        final var parallacticAngle = Math.atan2(Math.sin(hourAngle),
                Math.tan(latitude) * Math.cos(dec) - Math.sin(dec) * Math.cos(hourAngle));

        // Alignment columns are the station p, q, r axes expressed in ITRF.
        final var local = rotation.getMatrix().transpose().operate(source.toArray());
        final var theta = Math.acos(clamp(local[2]));
        final var phi = Math.atan2(local[1], local[0]);

        if (Double.isNaN(theta) || Double.isNaN(phi) || Double.isNaN(parallacticAngle)) {
            throw new CoordinateTransformException("Pointing for " + geometry.getStation() + " at " + time + " is undefined");
        }
        return new StationPointing(time, theta, phi, azimuth, elevation, parallacticAngle);
    }

    /**
     * GMST in radians, IAU 1982 expression.
     */
    public static double greenwichMeanSiderealTime(Instant time) {
        final var jd = time.getEpochSecond() / SECONDS_PER_DAY + time.getNano() / (SECONDS_PER_DAY * 1e9) + UNIX_EPOCH_JD;
        final var d = jd - J2000_JD;
        final var t = d / 36525.0;
        final var degrees = 280.46061837 + 360.98564736629 * d + 0.000387933 * t * t - t * t * t / 38710000.0;
        return normalize(Math.toRadians(degrees % 360.0));
    }

    static double geodeticLatitude(double p, double z) {
        var latitude = Math.atan2(z, p * (1 - WGS84_E2));
        for (int i = 0; i < GEODETIC_ITERATIONS; i++) {
            final var sin = Math.sin(latitude);
            final var n = WGS84_A / Math.sqrt(1 - WGS84_E2 * sin * sin);
            final var height = p / Math.cos(latitude) - n;
            latitude = Math.atan2(z, p * (1 - WGS84_E2 * n / (n + height)));
        }
        return latitude;
    }

    private static void checkDirection(CelestialDirection direction) {
        final var frame = direction.getFrame() == null ? "" : direction.getFrame().toUpperCase(Locale.ROOT);
        if (!SUPPORTED_FRAMES.contains(frame)) {
            throw new CoordinateTransformException("Unsupported reference frame '" + direction.getFrame() + "'");
        }
        if (!Double.isFinite(direction.getRightAscension()) || !Double.isFinite(direction.getDeclination())) {
            throw new CoordinateTransformException("Direction " + direction + " is not finite");
        }
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }

    private static double normalize(double angle) {
        final var twoPi = 2 * Math.PI;
        final var result = angle % twoPi;
        return result < 0 ? result + twoPi : result;
    }
}
