package org.stationbeam.generators;

import lombok.experimental.UtilityClass;
import org.apache.commons.math3.complex.Complex;

@UtilityClass
public class JonesMath {
    /**
     * {@code J · R(angle)} with {@code R = [[cos, -sin], [sin, cos]]}.
     */
    public static Complex[][] rotate(Complex[][] jones, double angle) {
        final var cos = Math.cos(angle);
        final var sin = Math.sin(angle);
        final var result = new Complex[2][2];
        for (int row = 0; row < 2; row++) {
            result[row][0] = jones[row][0].multiply(cos).add(jones[row][1].multiply(sin));
            result[row][1] = jones[row][0].multiply(-sin).add(jones[row][1].multiply(cos));
        }
        return result;
    }

    /**
     * Power of the p (X) and q (Y) channels for unpolarised input.
     */
    public static double[] channelPowers(Complex[][] jones) {
        final var p = square(jones[0][0]) + square(jones[0][1]);
        final var q = square(jones[1][1]) + square(jones[1][0]);
        return new double[]{p, q};
    }

    private static double square(Complex value) {
        final var abs = value.abs();
        return abs * abs;
    }
}
