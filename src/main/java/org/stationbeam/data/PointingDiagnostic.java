package org.stationbeam.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Per-sample pointing state used by the parallactic correction. Angles in radians.
 */
@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class PointingDiagnostic {
    private final Instant time;
    private final double parallacticAngle;
    private final double azimuth;
    private final double elevation;
}
