package org.stationbeam.exceptions;

public enum ErrorKind {
    NOT_FOUND,
    MALFORMED,
    INVALID_ARGUMENT,
    RANGE,
    NO_MATCHING_CHANNEL,
    DESERIALIZE,
    EPOCH_UNAVAILABLE,
    COORDINATE_TRANSFORM,
    CONFIGURATION
}
