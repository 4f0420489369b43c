package org.stationbeam.exceptions;

public class TelescopeModelDeserializeException extends StationBeamException {
    public TelescopeModelDeserializeException(String message) {
        super(ErrorKind.DESERIALIZE, message);
    }

    public TelescopeModelDeserializeException(String message, Throwable cause) {
        super(ErrorKind.DESERIALIZE, message, cause);
    }
}
