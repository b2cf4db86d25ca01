// file: storage/src/main/java/io/proxgraph/storage/RecordCodec.java
package io.proxgraph.storage;

import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.PeerRef;
import io.proxgraph.core.SnapshotId;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x9A7C
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - type: byte (see {@link GraphRecord})
 *     - RegistryInit: registryId, creator, capabilityId (strings)
 *     - UserCreated:  userId (string), counted (byte), synthetic (byte), snapshot
 *     - NodeAppended: userId (string), snapshot
 * <p>
 *   snapshot := id int64, owner string, timestamp int64, previous int64 (0 = none),
 *               neighborCount int32, neighbors (strings)
 *   string   := int32 len + UTF-8 bytes
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x9A7C;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 11;

    private RecordCodec() {
    }

    /** Encode a record into header+payload bytes ready for append. */
    static byte[] encode(GraphRecord rec) {
        byte[] payload = encodePayload(rec);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static GraphRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        byte type = b.get();
        return switch (type) {
            case GraphRecord.TYPE_REGISTRY_INIT -> new GraphRecord.RegistryInit(
                    readString(b), new Identity(readString(b)), readString(b));
            case GraphRecord.TYPE_USER_CREATED -> {
                String userId = readString(b);
                boolean counted = b.get() != 0;
                boolean synthetic = b.get() != 0;
                yield new GraphRecord.UserCreated(userId, counted, synthetic, readSnapshot(b));
            }
            case GraphRecord.TYPE_NODE_APPENDED -> new GraphRecord.NodeAppended(readString(b), readSnapshot(b));
            default -> throw new IllegalArgumentException("unknown record type: " + type);
        };
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(GraphRecord rec) {
        var out = new Buf();
        if (rec instanceof GraphRecord.RegistryInit r) {
            out.put(GraphRecord.TYPE_REGISTRY_INIT);
            out.putString(r.registryId());
            out.putString(r.creator().value());
            out.putString(r.capabilityId());
        } else if (rec instanceof GraphRecord.UserCreated u) {
            out.put(GraphRecord.TYPE_USER_CREATED);
            out.putString(u.userId());
            out.put((byte) (u.counted() ? 1 : 0));
            out.put((byte) (u.synthetic() ? 1 : 0));
            writeSnapshot(out, u.root());
        } else if (rec instanceof GraphRecord.NodeAppended n) {
            out.put(GraphRecord.TYPE_NODE_APPENDED);
            out.putString(n.userId());
            writeSnapshot(out, n.snapshot());
        } else {
            throw new IllegalArgumentException("unknown record: " + rec);
        }
        return out.toByteArray();
    }

    private static void writeSnapshot(Buf out, NodeSnapshot s) {
        out.putLong(s.id().value());
        out.putString(s.owner().value());
        out.putLong(s.timestampMillis());
        out.putLong(s.previous().map(SnapshotId::value).orElse(0L));
        out.putInt(s.neighbors().size());
        for (PeerRef p : s.neighbors()) {
            out.putString(p.value());
        }
    }

    private static NodeSnapshot readSnapshot(ByteBuffer b) {
        long id = b.getLong();
        String owner = readString(b);
        long ts = b.getLong();
        long prev = b.getLong();
        int n = b.getInt();
        if (n < 0) throw new IllegalArgumentException("negative neighbor count: " + n);
        List<PeerRef> neighbors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            neighbors.add(new PeerRef(readString(b)));
        }
        return new NodeSnapshot(new SnapshotId(id), new Identity(owner), neighbors, ts,
                prev == 0 ? null : new SnapshotId(prev));
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) throw new IllegalArgumentException("bad string length: " + len);
        byte[] s = new byte[len];
        b.get(s);
        return new String(s, StandardCharsets.UTF_8);
    }

    /** Growable little-endian buffer for payload assembly. */
    private static final class Buf {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream(128);
        private final ByteBuffer scratch = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);

        void put(byte v) { bytes.write(v); }

        void putInt(int v) {
            scratch.clear();
            scratch.putInt(v);
            bytes.write(scratch.array(), 0, 4);
        }

        void putLong(long v) {
            scratch.clear();
            scratch.putLong(v);
            bytes.write(scratch.array(), 0, 8);
        }

        void putString(String s) {
            byte[] data = s.getBytes(StandardCharsets.UTF_8);
            putInt(data.length);
            bytes.write(data, 0, data.length);
        }

        byte[] toByteArray() { return bytes.toByteArray(); }
    }
}
