package io.postrelay.channel;

/**
 * Proof that the holder may send on the channel named by {@code path}. Only a
 * {@link CapabilityKeeper} mints these.
 */
public record Capability(long index, String path) {
}
