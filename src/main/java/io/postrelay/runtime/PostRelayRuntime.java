package io.postrelay.runtime;

import io.postrelay.channel.CapabilityKeeper;
import io.postrelay.channel.ChannelKeeper;
import io.postrelay.channel.InMemoryCapabilityKeeper;
import io.postrelay.channel.InMemoryChannelKeeper;
import io.postrelay.codec.AcknowledgementCodec;
import io.postrelay.codec.PacketCodec;
import io.postrelay.config.PostRelayConfig;
import io.postrelay.config.RelaySettings;
import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.Height;
import io.postrelay.model.Packet;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;
import io.postrelay.observability.AuditLogger;
import io.postrelay.observability.AuditPacketEventSink;
import io.postrelay.observability.PacketEventSink;
import io.postrelay.observability.Slf4jPacketEventSink;
import io.postrelay.relay.AckReconciler;
import io.postrelay.relay.PostPacketModule;
import io.postrelay.relay.PostReceiver;
import io.postrelay.relay.PostTransmitter;
import io.postrelay.relay.TimeoutReconciler;
import io.postrelay.storage.Database;
import io.postrelay.storage.PacketResolutionStore;
import io.postrelay.storage.PostStore;
import io.postrelay.storage.SentPostStore;
import io.postrelay.storage.TimedOutPostStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * One chain: its stores, its relay components and the packet module the transport calls into.
 */
public final class PostRelayRuntime {
    private static final Logger log = LoggerFactory.getLogger(PostRelayRuntime.class);

    private final PostRelayConfig config;
    private final RelaySettings settings;
    private final Database database;
    private final PostStore postStore;
    private final SentPostStore sentPostStore;
    private final TimedOutPostStore timedOutPostStore;
    private final PacketResolutionStore resolutionStore;
    private final AuditLogger auditLogger;
    private final PacketEventSink events;
    private final PostTransmitter transmitter;
    private final PostPacketModule module;
    private final LongSupplier nanoClock;

    public PostRelayRuntime(PostRelayConfig config) {
        this(config, new InMemoryChannelKeeper(), new InMemoryCapabilityKeeper());
    }

    public PostRelayRuntime(PostRelayConfig config, ChannelKeeper channelKeeper, CapabilityKeeper capabilityKeeper) {
        this(config, channelKeeper, capabilityKeeper, PostRelayRuntime::wallClockNanos);
    }

    public PostRelayRuntime(PostRelayConfig config, ChannelKeeper channelKeeper, CapabilityKeeper capabilityKeeper, LongSupplier nanoClock) {
        this.config = config;
        this.settings = RelaySettings.load(config.settingsFile());
        this.database = new Database(config);
        this.postStore = new PostStore(database);
        this.sentPostStore = new SentPostStore(database);
        this.timedOutPostStore = new TimedOutPostStore(database);
        this.resolutionStore = new PacketResolutionStore(database);
        this.nanoClock = nanoClock;
        PacketEventSink logSink = new Slf4jPacketEventSink(config.chainId());
        if (settings.auditEnabled()) {
            this.auditLogger = new AuditLogger(config.auditFile(), config.chainId());
            this.events = PacketEventSink.both(logSink, new AuditPacketEventSink(auditLogger));
        } else {
            this.auditLogger = null;
            this.events = logSink;
        }
        this.transmitter = new PostTransmitter(channelKeeper, capabilityKeeper, PacketCodec.JSON, events);
        this.module = new PostPacketModule(
                PacketCodec.JSON,
                AcknowledgementCodec.JSON,
                new PostReceiver(postStore, events),
                new AckReconciler(sentPostStore, resolutionStore, PacketCodec.JSON, events),
                new TimeoutReconciler(timedOutPostStore, events),
                events
        );
    }

    public void init() {
        database.init();
        log.debug("Initialized chain {} at {}", config.chainId(), config.rootDir());
    }

    public PostRelayConfig config() {
        return config;
    }

    public RelaySettings settings() {
        return settings;
    }

    public PostPacketModule module() {
        return module;
    }

    /**
     * Creates a post authored on this chain. Local creators may not contain {@code -}, which keeps
     * them distinct from the {@code port-channel-creator} names of received posts.
     */
    public PostRecord createPost(String creator, String title, String content) throws PostRelayException {
        PostPayload payload = new PostPayload(creator, title, content);
        payload.validate();
        if (creator.contains("-")) {
            throw new PostRelayException(ErrorKind.VALIDATION_ERROR, "local post creator cannot contain '-': " + creator);
        }
        return postStore.append(creator, title, payload.content());
    }

    /**
     * Sends a post to the chain at the other end of {@code (port, channel)}. With neither a
     * timeout height nor a timeout timestamp, the packet expires
     * {@link RelaySettings#packetTimeoutRelativeMs()} from now.
     */
    public Packet sendPost(SendPostRequest request) throws PostRelayException {
        PostPayload payload = new PostPayload(request.creator(), request.title(), request.content());
        payload.validate();
        Height timeoutHeight = request.timeoutHeight() == null ? Height.ZERO : request.timeoutHeight();
        long timeoutTimestamp = request.timeoutTimestamp();
        if (timeoutHeight.isZero() && timeoutTimestamp == 0L) {
            timeoutTimestamp = nanoClock.getAsLong() + TimeUnit.MILLISECONDS.toNanos(settings.packetTimeoutRelativeMs());
        }
        return transmitter.send(payload, request.port(), request.channel(), timeoutHeight, timeoutTimestamp);
    }

    public Optional<PostRecord> getPost(long id) {
        return postStore.get(id);
    }

    public List<PostRecord> listPosts(int limit, int offset) {
        return postStore.list(limit <= 0 ? settings.defaultListLimit() : limit, offset);
    }

    public Optional<SentPostRecord> getSentPost(long id) {
        return sentPostStore.get(id);
    }

    public List<SentPostRecord> listSentPosts(int limit, int offset) {
        return sentPostStore.list(limit <= 0 ? settings.defaultListLimit() : limit, offset);
    }

    public Optional<TimedOutPostRecord> getTimedOutPost(long id) {
        return timedOutPostStore.get(id);
    }

    public List<TimedOutPostRecord> listTimedOutPosts(int limit, int offset) {
        return timedOutPostStore.list(limit <= 0 ? settings.defaultListLimit() : limit, offset);
    }

    public Stats stats() {
        return new Stats(config.chainId(), postStore.count(), sentPostStore.count(), timedOutPostStore.count());
    }

    public PostStore postStore() {
        return postStore;
    }

    public SentPostStore sentPostStore() {
        return sentPostStore;
    }

    public TimedOutPostStore timedOutPostStore() {
        return timedOutPostStore;
    }

    public PacketResolutionStore resolutionStore() {
        return resolutionStore;
    }

    public Optional<AuditLogger> auditLogger() {
        return Optional.ofNullable(auditLogger);
    }

    long nowNanos() {
        return nanoClock.getAsLong();
    }

    private static long wallClockNanos() {
        Instant now = Instant.now();
        return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
    }

    /**
     * @param timeoutTimestamp absolute unix nanoseconds, 0 for none
     */
    public record SendPostRequest(
            String creator,
            String title,
            String content,
            String port,
            String channel,
            Height timeoutHeight,
            long timeoutTimestamp
    ) {
    }

    public record Stats(String chainId, long posts, long sentPosts, long timedOutPosts) {
    }
}
