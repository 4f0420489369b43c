package org.stationbeam.exceptions;

import lombok.Getter;

@Getter
public abstract class StationBeamException extends RuntimeException {
    private final ErrorKind kind;

    protected StationBeamException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected StationBeamException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
