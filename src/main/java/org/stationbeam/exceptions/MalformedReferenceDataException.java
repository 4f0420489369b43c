package org.stationbeam.exceptions;

public class MalformedReferenceDataException extends StationBeamException {
    public MalformedReferenceDataException(String message) {
        super(ErrorKind.MALFORMED, message);
    }

    public MalformedReferenceDataException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED, message, cause);
    }
}
