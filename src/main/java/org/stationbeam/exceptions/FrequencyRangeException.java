package org.stationbeam.exceptions;

public class FrequencyRangeException extends StationBeamException {
    public FrequencyRangeException(String message) {
        super(ErrorKind.RANGE, message);
    }
}
