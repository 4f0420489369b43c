package org.stationbeam.data;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Evenly spaced channel centres {@code start + k * width}, {@code k < count}.
 */
@Getter
@Setter
@NoArgsConstructor
public class Channelization {
    private double start;
    private double width;
    private int count;

    public Channelization(double start, double width, int count) {
        this.start = start;
        this.width = width;
        this.count = count;
    }

    public double[] frequencies() {
        final var result = new double[count];
        for (int k = 0; k < count; k++) {
            result[k] = start + k * width;
        }
        return result;
    }
}
