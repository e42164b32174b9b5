package io.postrelay.channel;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemoryCapabilityKeeper implements CapabilityKeeper {
    private final Map<String, Capability> capabilities = new ConcurrentHashMap<>();
    private final AtomicLong nextIndex = new AtomicLong(1L);

    /** Mints the capability for {@code path}, or returns the one already minted. */
    public Capability claim(String path) {
        return capabilities.computeIfAbsent(path, p -> new Capability(nextIndex.getAndIncrement(), p));
    }

    public void release(String path) {
        capabilities.remove(path);
    }

    @Override
    public Optional<Capability> capability(String path) {
        return Optional.ofNullable(capabilities.get(path));
    }
}
