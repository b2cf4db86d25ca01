// file: storage/src/main/java/io/proxgraph/storage/Wal.java
package io.proxgraph.storage;

/**
 * Append-only log of graph mutations.
 * <p>
 * Each frame carries exactly one {@link GraphRecord}: a registry init, a user
 * creation (root snapshot included) or a node append. A frame is either fully
 * on disk or ignored: recovery stops at the first frame whose length or CRC
 * does not check out, and the store rebuilds memory from the frames before it.
 * append() returns only after the frame has been forced to disk.
 */
public interface Wal extends AutoCloseable {

    /** Write one encoded frame from {@link RecordCodec#encode} and fsync it. */
    void append(byte[] frame);

    /** Start a new segment once the current one is over its size limit. */
    void rotateIfNeeded();

    /** Iterate record payloads across all segments, oldest segment first. */
    WalReader openReader();

    @Override
    void close();

    /** Sequential payload iterator used by {@link DurableGraphStore} on startup. */
    interface WalReader extends AutoCloseable {

        /** @return the next record payload without its frame header, or null at the end of valid data */
        byte[] next();

        @Override
        void close();
    }
}
