// file: server/src/main/java/io/proxgraph/server/dto/SyntheticUpdateRequest.java
package io.proxgraph.server.dto;

import java.util.List;

/**
 * JSON body for PUT /dev/users/{userId}/node.
 */
public class SyntheticUpdateRequest {
    public String capabilityId;
    public List<String> neighbors;
}
