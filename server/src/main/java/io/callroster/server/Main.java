// file: src/main/java/io/callroster/server/Main.java
package io.callroster.server;

import io.callroster.core.PeerId;
import io.callroster.server.gateway.HttpCallNetwork;
import io.callroster.server.gateway.PushUpdateFeed;
import io.callroster.sync.ParticipantsContext;
import io.callroster.sync.SyncConfig;
import io.callroster.sync.SyncEnvironment;
import io.callroster.sync.peer.InMemoryPeerDirectory;
import io.callroster.sync.queue.ExecutorCallQueue;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the roster sidecar.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire the gateway client, the push feed and the peer directory.
 *  - Load the followed call's roster and start its context.
 *  - Start the HTTP server for pushes, speaking reports and debug reads.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        SyncConfig syncConfig = cfg.syncConfigPath() != null && !cfg.syncConfigPath().isBlank()
                ? SyncConfig.fromJsonFile(Path.of(cfg.syncConfigPath()))
                : SyncConfig.defaults();

        // ------ Transport -------
        var peers = new InMemoryPeerDirectory();
        var viewer = PeerId.of(cfg.viewerId());
        var network = new HttpCallNetwork(URI.create(cfg.gatewayUrl()), viewer, peers);
        var feed = new PushUpdateFeed();

        // ------ Engine -------
        var queue = new ExecutorCallQueue(Long.toString(cfg.callId()));
        var env = new SyncEnvironment(network, peers, feed, null, queue, Clock.systemUTC(), syncConfig);
        var calls = new CallRegistry();

        ParticipantsContext ctx;
        try {
            ctx = ParticipantsContext.load(cfg.callId(), viewer, null, env).join();
        } catch (CompletionException e) {
            log.log(Level.SEVERE, "Failed to load call " + cfg.callId() + " from " + cfg.gatewayUrl(), e.getCause());
            queue.shutdown();
            System.exit(1);
            return;
        }
        calls.register(ctx);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), calls, feed, peers);
        web.start();

        System.out.printf(
                "Following call %d as peer %d, listening on http://%s:%d (gateway %s)%n",
                cfg.callId(), cfg.viewerId(), "localhost", cfg.httpPort(), cfg.gatewayUrl()
        );

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            calls.closeAll();
            queue.shutdown();
        }));
    }
}
