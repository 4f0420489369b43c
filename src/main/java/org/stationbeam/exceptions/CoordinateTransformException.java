package org.stationbeam.exceptions;

public class CoordinateTransformException extends StationBeamException {
    public CoordinateTransformException(String message) {
        super(ErrorKind.COORDINATE_TRANSFORM, message);
    }

    public CoordinateTransformException(String message, Throwable cause) {
        super(ErrorKind.COORDINATE_TRANSFORM, message, cause);
    }
}
