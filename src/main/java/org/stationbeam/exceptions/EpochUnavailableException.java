package org.stationbeam.exceptions;

public class EpochUnavailableException extends StationBeamException {
    public EpochUnavailableException(String message) {
        super(ErrorKind.EPOCH_UNAVAILABLE, message);
    }
}
