package org.stationbeam.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.Arrays;
import java.util.List;

/**
 * Station layout of one telescope band, kept as parallel arrays in file order.
 * Names are not deduplicated.
 */
@Getter
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class ArrayConfiguration {
    private final String telescope;
    private final String band;
    private final double[] x;
    private final double[] y;
    private final double[] z;
    private final double[] diameters;
    private final String[] names;

    public int size() {
        return names.length;
    }

    /**
     * @return index of the first station called {@code name}, or -1
     */
    public int indexOf(String name) {
        for (int i = 0; i < names.length; i++) {
            if (names[i].equals(name)) return i;
        }
        return -1;
    }

    public StationRecord getRecord(int index) {
        return new StationRecord(names[index], new Vector3D(x[index], y[index], z[index]), diameters[index]);
    }

    public List<String> getStationNames() {
        return Arrays.asList(names.clone());
    }
}
