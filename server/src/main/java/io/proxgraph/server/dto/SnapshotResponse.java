// file: server/src/main/java/io/proxgraph/server/dto/SnapshotResponse.java
package io.proxgraph.server.dto;

import java.util.List;

/**
 * JSON view of one frozen snapshot. previous is null for a root.
 */
public class SnapshotResponse {
    public long id;
    public String owner;
    public List<String> neighbors;
    public long timestampMillis;
    public Long previous;
}
