package org.stationbeam.data;

import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

import java.time.Instant;
import java.util.List;

/**
 * Jones matrices over time and frequency. The tensor is indexed
 * {@code [frequency][time][row][column]} and always has shape
 * {@code (freqs.length, times.size(), 2, 2)}.
 */
public class JonesGrid {
    @Getter
    private final List<Instant> times;
    private final double[] freqs;
    private final Complex[][][][] tensor;

    public JonesGrid(List<Instant> times, double[] freqs, Complex[][][][] tensor) {
        checkShape(times.size(), freqs.length, tensor);
        this.times = List.copyOf(times);
        this.freqs = freqs.clone();
        this.tensor = new Complex[tensor.length][][][];
        for (int fi = 0; fi < tensor.length; fi++) {
            this.tensor[fi] = new Complex[tensor[fi].length][][];
            for (int ti = 0; ti < tensor[fi].length; ti++) {
                this.tensor[fi][ti] = copy(tensor[fi][ti]);
            }
        }
    }

    /**
     * @return a copy of the ascending channel frequencies in Hz
     */
    public double[] getFreqs() {
        return freqs.clone();
    }

    public double getFrequency(int frequencyIndex) {
        return freqs[frequencyIndex];
    }

    public int timeCount() {
        return times.size();
    }

    public int frequencyCount() {
        return freqs.length;
    }

    public Complex[][] get(int frequencyIndex, int timeIndex) {
        return copy(tensor[frequencyIndex][timeIndex]);
    }

    public int[] shape() {
        return new int[]{freqs.length, times.size(), 2, 2};
    }

    private static void checkShape(int timeCount, int freqCount, Complex[][][][] tensor) {
        if (tensor.length != freqCount) {
            throw new IllegalArgumentException("Tensor has " + tensor.length + " frequency rows, expected " + freqCount);
        }
        for (final var perFrequency : tensor) {
            if (perFrequency.length != timeCount) {
                throw new IllegalArgumentException("Tensor has " + perFrequency.length + " time samples, expected " + timeCount);
            }
            for (final var matrix : perFrequency) {
                if (matrix.length != 2 || matrix[0].length != 2 || matrix[1].length != 2) {
                    throw new IllegalArgumentException("Jones matrices must be 2x2");
                }
            }
        }
    }

    private static Complex[][] copy(Complex[][] matrix) {
        return new Complex[][]{matrix[0].clone(), matrix[1].clone()};
    }
}
