package org.stationbeam.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Station orientation as read from disk. Shape is whatever the file held;
 * consumers that need a rotation check {@link #isSquare(int)} themselves.
 */
@Getter
@RequiredArgsConstructor
public class AlignmentMatrix {
    private final String telescope;
    private final String station;
    private final String band;
    private final RealMatrix matrix;

    public int getRows() {
        return matrix.getRowDimension();
    }

    public int getColumns() {
        return matrix.getColumnDimension();
    }

    public boolean isSquare(int dimension) {
        return getRows() == dimension && getColumns() == dimension;
    }

    public static AlignmentMatrix of(String telescope, String station, String band, double[][] values) {
        return new AlignmentMatrix(telescope, station, band, MatrixUtils.createRealMatrix(values));
    }
}
