// file: server/src/main/java/io/proxgraph/server/Main.java
package io.proxgraph.server;

import io.proxgraph.core.Identity;
import io.proxgraph.server.events.FanoutEventSink;
import io.proxgraph.server.events.LoggingEventSink;
import io.proxgraph.storage.DurableGraphStore;
import io.proxgraph.storage.FileSnapshotter;
import io.proxgraph.storage.FileWal;
import io.proxgraph.storage.SnapshotPolicy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.logging.Logger;

/**
 * Entry point for a proximity graph server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire together storage components (WAL, snapshots, DurableGraphStore).
 *  - Run the bootstrap step and hand the dev capability id to the deployer.
 *  - Create ProximityService and WebServer and start HTTP.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage Layer -------
        var wal = new FileWal(Path.of(cfg.walDir()), 64L * 1024 * 1024); // rotate ~64MB
        var snaps = new FileSnapshotter(Path.of(cfg.snapDir()));
        var store = new DurableGraphStore(wal, snaps, new SnapshotPolicy(cfg.snapshotEvery()));

        // ------ Events -------
        var events = new FanoutEventSink(new LoggingEventSink());

        // ------ Bootstrap -------
        GraphHandles handles = Bootstrap.init(store, new Identity(cfg.deployer()), events);
        writeCapability(Path.of(cfg.capabilityFile()), handles.capability().id());

        // ------ Service + HTTP -------
        var service = new ProximityService(store, events);
        var web = new WebServer(cfg.httpPort(), service, Clock.systemUTC());

        web.start();
        System.out.printf(
                "Proximity graph %s listening on http://localhost:%d (deployer %s)%n",
                handles.registryId(), cfg.httpPort(), cfg.deployer()
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                store.close();
            }
        }));
    }

    /**
     * The capability id is a bearer secret. On POSIX filesystems the file is
     * created owner-only before any byte is written; an older file is replaced.
     */
    static void writeCapability(Path file, String capabilityId) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.deleteIfExists(file);
            Files.createFile(file, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        } else {
            log.warning("filesystem has no POSIX permissions; " + file + " keeps default access");
        }
        Files.writeString(file, capabilityId + System.lineSeparator(), StandardCharsets.UTF_8);
        log.info("dev capability id written to " + file);
    }
}
