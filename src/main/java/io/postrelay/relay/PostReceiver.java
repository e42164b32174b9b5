package io.postrelay.relay;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckResult;
import io.postrelay.model.Packet;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.observability.NullPacketEventSink;
import io.postrelay.observability.PacketEventSink;
import io.postrelay.storage.PostStore;

/**
 * Applies a post received from another chain.
 */
public final class PostReceiver {
    private final PostStore postStore;
    private final PacketEventSink events;

    public PostReceiver(PostStore postStore) {
        this(postStore, NullPacketEventSink.INSTANCE);
    }

    public PostReceiver(PostStore postStore, PacketEventSink events) {
        this.postStore = postStore;
        this.events = events;
    }

    /**
     * Stores the post with creator {@code sourcePort-sourceChannel-creator} and returns its id.
     *
     * @throws PostRelayException {@code VALIDATION_ERROR} if creator or title is blank; the post
     *                            store is left untouched
     */
    public AckResult receive(Packet packet, PostPayload payload) throws PostRelayException {
        payload.validate();

        // <port>-<channel>-<creator> tells apart equal creator names from different chains.
        PostRecord record = postStore.append(
                packet.sourcePrefix() + payload.creator(),
                payload.title(),
                payload.content()
        );
        events.onPostReceived(packet, record);
        return AckResult.of(record.id());
    }
}
