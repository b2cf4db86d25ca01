// file: storage/src/main/java/io/proxgraph/storage/FileWal.java
package io.proxgraph.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment ("00000001.log", "00000002.log", ...),
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - validates magic/version/length and CRC of every record,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] frame) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(frame);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so a freshly rotated file is durable
            writtenInSegment += frame.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
            current = dir.resolve(String.format("%08d.log", index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            log.fine(() -> "WAL rotated to " + current);
        } catch (IOException e) {
            throw new UncheckedIOException("WAL rotation failed", e);
        }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException("WAL close failed", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve("00000001.log") : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.warning("truncating torn WAL tail in " + current + " from " + ch.size() + " to " + valid + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open WAL segment in " + dir, e);
        }
    }

    /** Length of the prefix of {@code seg} made of complete, CRC-valid records. */
    private static long validLength(FileChannel seg) throws IOException {
        long pos = 0;
        long size = seg.size();
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        while (pos + RecordCodec.HEADER_BYTES <= size) {
            hdr.clear();
            if (seg.read(hdr, pos) < RecordCodec.HEADER_BYTES) break;
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) break;
            if (pos + RecordCodec.HEADER_BYTES + len > size) break;
            ByteBuffer payload = ByteBuffer.allocate(len);
            if (len > 0 && seg.read(payload, pos + RecordCodec.HEADER_BYTES) < len) break;
            if (RecordCodec.crc32(payload.array()) != crc) break;
            pos += RecordCodec.HEADER_BYTES + (long) len;
        }
        return pos;
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list WAL directory " + dir, e);
        }
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     * A bad record ends the whole log, not just its segment: later records
     * could depend on the lost one.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIndex = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean done = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (done) return null;
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) {
                        done = true;
                        return null;
                    }
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {
                        // clean end of this segment, continue with the next one
                        ch.close();
                        ch = null;
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) return stop("truncated header");
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) {
                        return stop("bad header");
                    }
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = len == 0 ? 0 : ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) return stop("truncated payload");
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) return stop("CRC mismatch");
                    pos += RecordCodec.HEADER_BYTES + (long) len;
                    return bytes;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segIndex++;
            if (segIndex >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segIndex), READ);
            pos = 0;
            return true;
        }

        private byte[] stop(String reason) {
            log.warning(() -> "WAL replay stopped at " + segments.get(segIndex).getFileName()
                    + " offset " + pos + ": " + reason);
            done = true;
            return null;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException("WAL reader close failed", e);
            }
        }
    }
}
