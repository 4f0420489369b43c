package org.stationbeam.beam;

import org.apache.commons.math3.complex.Complex;
import org.stationbeam.data.BandModel;

/**
 * Polarimetric response of a station's dual-polarised element.
 */
public interface BeamModel {
    /**
     * Identifier used in telescope model file names and on the command line.
     */
    String getName();

    /**
     * Jones matrix for a direction given in the station frame. Rows are the X and Y
     * dipoles, columns the θ̂ and φ̂ components of the incoming field.
     *
     * @param band      band data of the telescope model
     * @param theta     angle from the station's r-axis, radians
     * @param phi       angle from the station's p-axis towards q, radians
     * @param frequency Hz
     * @return new 2x2 array
     */
    Complex[][] response(BandModel band, double theta, double phi, double frequency);

    static Complex[][] zero() {
        return new Complex[][]{{Complex.ZERO, Complex.ZERO}, {Complex.ZERO, Complex.ZERO}};
    }
}
