// file: server/src/test/java/io/proxgraph/server/CapabilityFileSpec.java
package io.proxgraph.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * The dev capability file must never be readable by anyone but the owner.
 */
class CapabilityFileSpec {

    @TempDir
    Path dir;

    private void assumePosix() {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
    }

    @Test
    void file_is_created_owner_only_with_the_id() throws Exception {
        assumePosix();
        Path file = dir.resolve("nested").resolve("dev-capability");

        Main.writeCapability(file, "cap-123");

        assertEquals(PosixFilePermissions.fromString("rw-------"), Files.getPosixFilePermissions(file));
        assertEquals("cap-123", Files.readString(file, StandardCharsets.UTF_8).trim());
    }

    @Test
    void world_readable_leftover_is_replaced() throws Exception {
        assumePosix();
        Path file = dir.resolve("dev-capability");
        Files.writeString(file, "old-id-that-is-much-longer-than-the-new-one");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r--r--"));

        Main.writeCapability(file, "cap-456");

        assertEquals(PosixFilePermissions.fromString("rw-------"), Files.getPosixFilePermissions(file));
        assertEquals("cap-456", Files.readString(file, StandardCharsets.UTF_8).trim());
    }
}
