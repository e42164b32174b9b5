package io.postrelay.cli;

import io.postrelay.channel.ChannelOrder;
import io.postrelay.config.PostRelayConfig;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.Height;
import io.postrelay.model.Packet;
import io.postrelay.model.PostRecord;
import io.postrelay.observability.AuditLogger;
import io.postrelay.runtime.LoopbackRelay;
import io.postrelay.runtime.PostRelayRuntime;
import io.postrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(
        name = "postrelay",
        mixinStandardHelpOptions = true,
        description = "Cross-chain post relay CLI",
        subcommands = {
                PostRelayCommand.InitCommand.class,
                PostRelayCommand.CreatePostCommand.class,
                PostRelayCommand.PostsCommand.class,
                PostRelayCommand.PostCommand.class,
                PostRelayCommand.SentPostsCommand.class,
                PostRelayCommand.TimedOutPostsCommand.class,
                PostRelayCommand.StatsCommand.class,
                PostRelayCommand.SettingsCommand.class,
                PostRelayCommand.AuditVerifyCommand.class,
                PostRelayCommand.RelayDemoCommand.class
        }
)
public final class PostRelayCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--chain"}, description = "Chain id to operate on", defaultValue = PostRelayConfig.DEFAULT_CHAIN_ID)
    String chain;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create-post | posts | post | sent-posts | timed-out-posts | stats | settings | audit-verify | relay-demo");
    }

    PostRelayConfig config() {
        return PostRelayConfig.fromRoot(root, chain);
    }

    PostRelayRuntime runtime() {
        PostRelayRuntime runtime = new PostRelayRuntime(config());
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize the chain directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Override
        public Integer call() {
            parent.runtime();
            System.out.println("Initialized chain at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create-post", description = "Create a post on this chain")
    static final class CreatePostCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Option(names = {"--creator"}, required = true, description = "Post author")
        String creator;

        @Option(names = {"--title"}, required = true, description = "Post title")
        String title;

        @Option(names = {"--content"}, defaultValue = "", description = "Post body")
        String content;

        @Override
        public Integer call() {
            try {
                PostRecord post = parent.runtime().createPost(creator, title, content);
                System.out.println(Jsons.toJson(post));
                return 0;
            } catch (PostRelayException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 1;
            }
        }
    }

    @Command(name = "posts", description = "List posts stored on this chain")
    static final class PostsCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Max rows, 0 for the configured default")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Rows to skip")
        int offset;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listPosts(limit, offset)));
            return 0;
        }
    }

    @Command(name = "post", description = "Show one post")
    static final class PostCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Parameters(index = "0", description = "Post id")
        long id;

        @Override
        public Integer call() {
            Optional<PostRecord> post = parent.runtime().getPost(id);
            if (post.isEmpty()) {
                System.out.println("{\"error\":\"post not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(post.get()));
            return 0;
        }
    }

    @Command(name = "sent-posts", description = "List posts acknowledged by other chains")
    static final class SentPostsCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Max rows, 0 for the configured default")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Rows to skip")
        int offset;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listSentPosts(limit, offset)));
            return 0;
        }
    }

    @Command(name = "timed-out-posts", description = "List posts that never reached their destination")
    static final class TimedOutPostsCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Max rows, 0 for the configured default")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Rows to skip")
        int offset;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listTimedOutPosts(limit, offset)));
            return 0;
        }
    }

    @Command(name = "stats", description = "Count posts, sent posts and timed-out posts")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().stats()));
            return 0;
        }
    }

    @Command(name = "settings", description = "Show effective settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().settings()));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Override
        public Integer call() {
            Optional<AuditLogger> audit = parent.runtime().auditLogger();
            if (audit.isEmpty()) {
                System.out.println("{\"error\":\"audit disabled\"}");
                return 1;
            }
            AuditLogger.VerifyResult result = audit.get().verify();
            System.out.println(Jsons.toJson(result));
            return result.valid() ? 0 : 2;
        }
    }

    @Command(name = "relay-demo", description = "Send a post from --chain to another local chain over an in-process channel")
    static final class RelayDemoCommand implements Callable<Integer> {
        @ParentCommand
        PostRelayCommand parent;

        @Option(names = {"--to"}, required = true, description = "Destination chain id")
        String to;

        @Option(names = {"--creator"}, required = true, description = "Post author")
        String creator;

        @Option(names = {"--title"}, required = true, description = "Post title")
        String title;

        @Option(names = {"--content"}, defaultValue = "", description = "Post body")
        String content;

        @Option(names = {"--timeout-blocks"}, defaultValue = "0",
                description = "Time out after this many destination blocks; 0 uses the relative timestamp timeout")
        long timeoutBlocks;

        @Option(names = {"--expire"}, description = "Advance the destination past the timeout before relaying")
        boolean expire;

        @Option(names = {"--ordered"}, description = "Open an ordered channel, which closes when a packet times out")
        boolean ordered;

        @Override
        public Integer call() {
            LoopbackRelay relay = LoopbackRelay.open(
                    parent.config(),
                    PostRelayConfig.fromRoot(parent.root, to),
                    ordered ? ChannelOrder.ORDERED : ChannelOrder.UNORDERED,
                    RelayDemoCommand::nowNanos
            );
            try {
                LoopbackRelay.Endpoint source = relay.a();
                LoopbackRelay.Endpoint destination = relay.b();
                long blocks = expire && timeoutBlocks <= 0 ? 1L : timeoutBlocks;
                Height timeoutHeight = blocks > 0 ? destination.height().increment(blocks) : Height.ZERO;
                Packet packet = source.runtime().sendPost(new PostRelayRuntime.SendPostRequest(
                        creator,
                        title,
                        content,
                        source.channel().portId(),
                        source.channel().channelId(),
                        timeoutHeight,
                        0L
                ));
                if (expire) {
                    destination.advanceHeight(blocks);
                }
                LoopbackRelay.RelayReport report = relay.relayPending();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("packet", packet.toString());
                out.put("report", report);
                out.put("source", source.runtime().stats());
                out.put("destination", destination.runtime().stats());
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (PostRelayException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage(), "kind", e.kind().name())));
                return 1;
            }
        }

        private static long nowNanos() {
            Instant now = Instant.now();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        }
    }
}
