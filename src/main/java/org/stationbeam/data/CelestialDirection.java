package org.stationbeam.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Equatorial direction in radians with the frame it refers to.
 */
@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class CelestialDirection {
    public static final String J2000 = "J2000";

    private final double rightAscension;
    private final double declination;
    private final String frame;
}
