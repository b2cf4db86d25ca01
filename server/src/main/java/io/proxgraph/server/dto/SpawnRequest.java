// file: server/src/main/java/io/proxgraph/server/dto/SpawnRequest.java
package io.proxgraph.server.dto;

import java.util.List;

/**
 * JSON body for POST /dev/users.
 * Example:
 *   {
 *     "capabilityId": "3f0c...",
 *     "target": "bot-17",
 *     "neighbors": ["peer-b"]
 *   }
 */
public class SpawnRequest {
    public String capabilityId;
    public String target;           // identity the synthetic record is created for
    public List<String> neighbors;
}
