// file: storage/src/main/java/io/proxgraph/storage/FileSnapshotter.java
package io.proxgraph.storage;

import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.PeerRef;
import io.proxgraph.core.SnapshotId;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format (big-endian, DataOutputStream):
 *   int32 magic = 0x50474931 ("PGI1")
 *   boolean hasRegistry
 *     [registryId, creator, capabilityId : string]
 *   int32 registeredCount, registered identities (string)
 *   int32 snapshotCount, repeated:
 *     id int64, owner string, timestamp int64, previous int64 (0 = none),
 *     int32 neighborCount, neighbors (string)
 *   int32 userCount, repeated:
 *     userId string, owner string, synthetic boolean, head int64
 *   string := int32 len + UTF-8 bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<seq>.bin.tmp" first,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE.
 *   - seq is zero-padded so name order equals creation order.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final int MAGIC = 0x50474931;

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(GraphImage image) {
        String name = String.format("snapshot-%020d.bin", nextSequence());
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeInt(MAGIC);
            out.writeBoolean(image.hasRegistry());
            if (image.hasRegistry()) {
                writeString(out, image.registryId());
                writeString(out, image.creator().value());
                writeString(out, image.capabilityId());
            }

            out.writeInt(image.registered().size());
            for (Identity id : image.registered()) {
                writeString(out, id.value());
            }

            out.writeInt(image.snapshots().size());
            for (NodeSnapshot s : image.snapshots()) {
                out.writeLong(s.id().value());
                writeString(out, s.owner().value());
                out.writeLong(s.timestampMillis());
                out.writeLong(s.previous().map(SnapshotId::value).orElse(0L));
                out.writeInt(s.neighbors().size());
                for (PeerRef p : s.neighbors()) {
                    writeString(out, p.value());
                }
            }

            out.writeInt(image.users().size());
            for (GraphImage.UserImage u : image.users()) {
                writeString(out, u.userId());
                writeString(out, u.owner().value());
                out.writeBoolean(u.synthetic());
                out.writeLong(u.head().value());
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("snapshot write failed: " + tmp, ex);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot publish failed: " + dst, e);
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = list();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            if (in.readInt() != MAGIC) {
                throw new IllegalStateException("not a graph snapshot: " + snap);
            }
            String registryId = null;
            Identity creator = null;
            String capabilityId = null;
            if (in.readBoolean()) {
                registryId = readString(in);
                creator = new Identity(readString(in));
                capabilityId = readString(in);
            }

            int regCount = in.readInt();
            List<Identity> registered = new ArrayList<>(regCount);
            for (int i = 0; i < regCount; i++) {
                registered.add(new Identity(readString(in)));
            }

            int snapCount = in.readInt();
            List<NodeSnapshot> snapshots = new ArrayList<>(snapCount);
            for (int i = 0; i < snapCount; i++) {
                long id = in.readLong();
                Identity owner = new Identity(readString(in));
                long ts = in.readLong();
                long prev = in.readLong();
                int n = in.readInt();
                List<PeerRef> neighbors = new ArrayList<>(n);
                for (int j = 0; j < n; j++) {
                    neighbors.add(new PeerRef(readString(in)));
                }
                snapshots.add(new NodeSnapshot(new SnapshotId(id), owner, neighbors, ts,
                        prev == 0 ? null : new SnapshotId(prev)));
            }

            int userCount = in.readInt();
            List<GraphImage.UserImage> users = new ArrayList<>(userCount);
            for (int i = 0; i < userCount; i++) {
                String userId = readString(in);
                Identity owner = new Identity(readString(in));
                boolean synthetic = in.readBoolean();
                users.add(new GraphImage.UserImage(userId, owner, synthetic, new SnapshotId(in.readLong())));
            }

            var image = new GraphImage(registryId, creator, capabilityId, registered, snapshots, users);
            return new LoadedSnapshot(snap.getFileName().toString(), image);
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot read failed: " + snap, e);
        }
    }

    private long nextSequence() {
        List<Path> snaps = list();
        if (snaps.isEmpty()) return 1;
        String last = snaps.get(snaps.size() - 1).getFileName().toString();
        return Long.parseLong(last.substring("snapshot-".length(), last.length() - ".bin".length())) + 1;
    }

    private List<Path> list() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".bin");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list snapshot directory " + dir, e);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) throw new IOException("negative string length");
        byte[] b = in.readNBytes(len);
        if (b.length < len) throw new IOException("truncated string");
        return new String(b, StandardCharsets.UTF_8);
    }
}
