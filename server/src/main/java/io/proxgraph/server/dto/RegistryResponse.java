// file: server/src/main/java/io/proxgraph/server/dto/RegistryResponse.java
package io.proxgraph.server.dto;

import java.util.List;

/**
 * JSON response for GET /registry.
 */
public class RegistryResponse {
    public String registryId;
    public String creator;
    public List<String> registeredUsers;   // registration order
    public int userCount;                  // all records, synthetic included
}
