package io.postrelay.error;

public enum ErrorKind {
    CHANNEL_NOT_FOUND,
    SEQUENCE_NOT_FOUND,
    CAPABILITY_MISSING,
    ENCODING_ERROR,
    VALIDATION_ERROR,
    ACK_DECODE_ERROR,
    UNSUPPORTED_ACK_FORMAT,
    UNKNOWN_PACKET_TYPE,
    PACKET_REJECTED
}
