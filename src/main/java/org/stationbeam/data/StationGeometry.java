package org.stationbeam.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class StationGeometry {
    private final String station;
    private final Vector3D position;
    private final AlignmentMatrix rotation;
}
