package org.stationbeam.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * One row of an array configuration file. Position is telescope-centric
 * Cartesian (ITRF for LOFAR) in meters.
 */
@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class StationRecord {
    private final String name;
    private final Vector3D position;
    private final double diameter;
}
