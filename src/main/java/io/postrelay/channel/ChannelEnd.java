package io.postrelay.channel;

import java.util.Objects;

/**
 * The local end of an open channel and the (port, channel) pair it is connected to.
 */
public record ChannelEnd(
        String portId,
        String channelId,
        String counterpartyPortId,
        String counterpartyChannelId,
        ChannelOrder ordering
) {
    public ChannelEnd {
        Objects.requireNonNull(portId, "portId");
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(counterpartyPortId, "counterpartyPortId");
        Objects.requireNonNull(counterpartyChannelId, "counterpartyChannelId");
        ordering = ordering == null ? ChannelOrder.UNORDERED : ordering;
    }
}
