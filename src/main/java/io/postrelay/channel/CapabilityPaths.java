package io.postrelay.channel;

public final class CapabilityPaths {
    private CapabilityPaths() {
    }

    public static String channelCapabilityPath(String portId, String channelId) {
        return "capabilities/ports/" + portId + "/channels/" + channelId;
    }
}
