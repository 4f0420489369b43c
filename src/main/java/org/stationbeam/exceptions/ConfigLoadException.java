package org.stationbeam.exceptions;

public class ConfigLoadException extends StationBeamException {
    public ConfigLoadException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
