// file: server/src/main/java/io/proxgraph/server/dto/UserResponse.java
package io.proxgraph.server.dto;

import java.util.List;

/**
 * JSON view of a user record.
 * Example:
 *   {
 *     "userId": "8d1e...",
 *     "owner": "alice",
 *     "synthetic": false,
 *     "head": 12,
 *     "neighbors": ["bob"],
 *     "timestampMillis": 1728000000000
 *   }
 */
public class UserResponse {
    public String userId;
    public String owner;
    public boolean synthetic;
    public long head;
    public List<String> neighbors;
    public long timestampMillis;
}
