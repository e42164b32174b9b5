package io.postrelay.channel;

import java.util.Optional;

public interface CapabilityKeeper {
    Optional<Capability> capability(String path);
}
