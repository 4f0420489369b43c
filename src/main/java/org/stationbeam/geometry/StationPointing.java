package org.stationbeam.geometry;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.stationbeam.data.PointingDiagnostic;

import java.time.Instant;

/**
 * Where a tracked source is for a station at one instant. {@code theta}/{@code phi}
 * are spherical angles in the station frame; the rest are topocentric. Radians.
 */
@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class StationPointing {
    private final Instant time;
    private final double theta;
    private final double phi;
    private final double azimuth;
    private final double elevation;
    private final double parallacticAngle;

    public PointingDiagnostic toDiagnostic() {
        return new PointingDiagnostic(time, parallacticAngle, azimuth, elevation);
    }
}
