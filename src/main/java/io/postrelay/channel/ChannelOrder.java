package io.postrelay.channel;

public enum ChannelOrder {
    ORDERED,
    UNORDERED
}
