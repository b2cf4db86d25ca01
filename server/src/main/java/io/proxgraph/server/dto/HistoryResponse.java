// file: server/src/main/java/io/proxgraph/server/dto/HistoryResponse.java
package io.proxgraph.server.dto;

import java.util.List;

/**
 * JSON response for GET /users/{userId}/history, newest snapshot first.
 */
public class HistoryResponse {
    public String userId;
    public List<SnapshotResponse> snapshots;
}
