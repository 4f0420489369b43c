package org.stationbeam.beam;

import org.apache.commons.math3.complex.Complex;
import org.stationbeam.data.BandModel;

/**
 * Ideal short crossed dipoles lying in the station plane at ±45° to the p-axis.
 * The response is the projection of each dipole onto θ̂ and φ̂ and does not
 * depend on frequency.
 */
public class DipoleBeamModel implements BeamModel {
    public static final String NAME = "Dipole";
    private static final double X_DIPOLE_ANGLE = Math.PI / 4;
    private static final double Y_DIPOLE_ANGLE = 3 * Math.PI / 4;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Complex[][] response(BandModel band, double theta, double phi, double frequency) {
        return new Complex[][]{
                projection(X_DIPOLE_ANGLE, theta, phi),
                projection(Y_DIPOLE_ANGLE, theta, phi)
        };
    }

    // d·θ̂ = cosθ cos(φ-α), d·φ̂ = -sin(φ-α) for a horizontal dipole at azimuth α
    private static Complex[] projection(double dipoleAngle, double theta, double phi) {
        final var relative = phi - dipoleAngle;
        return new Complex[]{
                new Complex(Math.cos(theta) * Math.cos(relative)),
                new Complex(-Math.sin(relative))
        };
    }
}
