// file: core/src/main/java/io/proxgraph/core/SnapshotId.java
package io.proxgraph.core;

/**
 * Arena key for a {@link NodeSnapshot}.
 * Ids are assigned from a single monotonically increasing counter, so a
 * predecessor always has a smaller id than its successor.
 */
public record SnapshotId(long value) implements Comparable<SnapshotId> {

    public SnapshotId {
        if (value <= 0) throw new IllegalArgumentException("snapshot id must be > 0, got: " + value);
    }

    public static SnapshotId parse(String s) {
        try {
            return new SnapshotId(Long.parseLong(s));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid snapshot id: " + s, e);
        }
    }

    @Override
    public int compareTo(SnapshotId o) { return Long.compare(value, o.value); }

    @Override
    public String toString() { return Long.toString(value); }
}
