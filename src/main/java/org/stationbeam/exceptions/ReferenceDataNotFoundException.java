package org.stationbeam.exceptions;

public class ReferenceDataNotFoundException extends StationBeamException {
    public ReferenceDataNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public ReferenceDataNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
