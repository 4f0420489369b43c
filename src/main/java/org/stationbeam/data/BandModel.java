package org.stationbeam.data;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-band part of a telescope model: the channelization fixing the frequency
 * axis and, for polynomial element models, the element coefficients.
 * <p>
 * {@code coefficients[harmonic][thetaPower][freqPower]} holds
 * {@code {thetaRe, thetaIm, phiRe, phiIm}}. Frequencies are normalised as
 * {@code (f - frequencyCenter) / frequencyRange} before evaluation.
 */
@Getter
@Setter
@NoArgsConstructor
public class BandModel {
    private Channelization channelization;
    private double frequencyCenter;
    private double frequencyRange = 1.0;
    private double[][][][] coefficients;

    public double[] frequencies() {
        return channelization.frequencies();
    }

    public boolean hasCoefficients() {
        return coefficients != null && coefficients.length > 0;
    }
}
