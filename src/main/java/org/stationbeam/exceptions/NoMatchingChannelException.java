package org.stationbeam.exceptions;

public class NoMatchingChannelException extends StationBeamException {
    public NoMatchingChannelException(String message) {
        super(ErrorKind.NO_MATCHING_CHANNEL, message);
    }
}
