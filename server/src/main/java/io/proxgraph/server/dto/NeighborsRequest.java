// file: server/src/main/java/io/proxgraph/server/dto/NeighborsRequest.java
package io.proxgraph.server.dto;

import java.util.List;

/**
 * JSON body for POST /users and PUT /users/{userId}/node.
 * Example:
 *   {
 *     "neighbors": ["peer-b", "peer-c"]
 *   }
 * A missing or empty list publishes an empty neighbor set.
 */
public class NeighborsRequest {
    public List<String> neighbors;
}
