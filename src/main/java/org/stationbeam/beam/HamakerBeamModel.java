package org.stationbeam.beam;

import org.apache.commons.math3.complex.Complex;
import org.stationbeam.data.BandModel;
import org.stationbeam.exceptions.TelescopeModelDeserializeException;

/**
 * Hamaker-Arts element model: for each azimuthal harmonic {@code k} a polynomial
 * in θ whose coefficients are polynomials in normalised frequency. Harmonic
 * {@code k} contributes with azimuth {@code (2k+1)(φ - π/4)} and alternating sign.
 */
public class HamakerBeamModel implements BeamModel {
    public static final String NAME = "Hamaker";
    private static final double DIPOLE_OFFSET = Math.PI / 4;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Complex[][] response(BandModel band, double theta, double phi, double frequency) {
        if (!band.hasCoefficients()) {
            throw new TelescopeModelDeserializeException("Band model carries no Hamaker coefficients");
        }
        final var result = BeamModel.zero();
        // Below the horizon the element does not respond.
        if (theta > Math.PI / 2) {
            return result;
        }

        final var coefficients = band.getCoefficients();
        final var f = (frequency - band.getFrequencyCenter()) / band.getFrequencyRange();
        final var azimuth = phi - DIPOLE_OFFSET;

        for (int k = 0; k < coefficients.length; k++) {
            var pTheta = Complex.ZERO;
            var pPhi = Complex.ZERO;
            final var thetaPowers = coefficients[k];
            for (int i = thetaPowers.length - 1; i >= 0; i--) {
                final var freqPowers = thetaPowers[i];
                var innerTheta = Complex.ZERO;
                var innerPhi = Complex.ZERO;
                for (int j = freqPowers.length - 1; j >= 0; j--) {
                    innerTheta = innerTheta.multiply(f).add(new Complex(freqPowers[j][0], freqPowers[j][1]));
                    innerPhi = innerPhi.multiply(f).add(new Complex(freqPowers[j][2], freqPowers[j][3]));
                }
                pTheta = pTheta.multiply(theta).add(innerTheta);
                pPhi = pPhi.multiply(theta).add(innerPhi);
            }

            final var sign = (k % 2 == 0) ? 1.0 : -1.0;
            final var angle = (2 * k + 1) * azimuth;
            final var cos = sign * Math.cos(angle);
            final var sin = sign * Math.sin(angle);

            result[0][0] = result[0][0].add(pTheta.multiply(cos));
            result[0][1] = result[0][1].add(pPhi.multiply(-sin));
            result[1][0] = result[1][0].add(pTheta.multiply(sin));
            result[1][1] = result[1][1].add(pPhi.multiply(cos));
        }
        return result;
    }
}
