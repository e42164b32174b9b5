package io.postrelay.model;

/** Terminal state of an originated packet, as seen by the sending chain. */
public enum PacketResolution {
    ACKNOWLEDGED,
    ACK_ERROR,
    TIMED_OUT
}
