// file: storage/src/test/java/io/proxgraph/storage/DurableGraphStoreSpec.java
package io.proxgraph.storage;

import io.proxgraph.core.AlreadyRegisteredException;
import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeContents;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.PeerRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class DurableGraphStoreSpec {

    private static final Identity A = Identity.of("A");
    private static final Identity B = Identity.of("B");

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private DurableGraphStore store;

    @BeforeEach
    void open() {
        store = new DurableGraphStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), new SnapshotPolicy(50_000));
        store.initRegistry(Identity.of("deployer"));
    }

    @AfterEach
    void close() {
        store.close();
    }

    private static List<PeerRef> peers(String... ids) {
        return java.util.Arrays.stream(ids).map(PeerRef::of).toList();
    }

    @Test
    void registry_can_only_be_initialised_once() {
        assertThrows(IllegalStateException.class, () -> store.initRegistry(Identity.of("deployer")));
        assertEquals(Identity.of("deployer"), store.capability().orElseThrow().owner());
    }

    @Test
    void create_user_builds_root_snapshot_and_registers() {
        UserRecord rec = store.createUser(A, List.of(), 0, true);

        assertEquals(A, rec.owner());
        assertFalse(rec.synthetic());
        assertEquals(new NodeContents(List.of(), 0), rec.current());

        NodeSnapshot root = store.snapshot(rec.head()).orElseThrow();
        assertTrue(root.isRoot());
        assertEquals(List.of(A), store.registry().orElseThrow().registeredUsers());
    }

    @Test
    void duplicate_registration_has_no_side_effects() {
        store.createUser(A, List.of(), 0, true);
        int snapshotsBefore = store.snapshotCount();

        assertThrows(AlreadyRegisteredException.class, () -> store.createUser(A, peers("B"), 1, true));

        assertEquals(1, store.registry().orElseThrow().size());
        assertEquals(1, store.users().size());
        assertEquals(snapshotsBefore, store.snapshotCount());
    }

    @Test
    void uncounted_users_skip_the_registry() {
        store.createUser(A, List.of(), 0, false);
        store.createUser(A, List.of(), 0, false);
        assertEquals(0, store.registry().orElseThrow().size());

        // a synthetic identity can still register for real afterwards
        assertDoesNotThrow(() -> store.createUser(A, List.of(), 0, true));
        assertEquals(3, store.users().size());
    }

    @Test
    void append_repoints_head_and_links_previous() {
        UserRecord rec = store.createUser(A, List.of(), 0, true);
        var oldHead = rec.head();

        NodeSnapshot next = store.appendNode(rec.id(), peers("B"), 10_000);

        assertEquals(oldHead, next.previous().orElseThrow());
        assertEquals(next.id(), rec.head());
        assertEquals(new NodeContents(peers("B"), 10_000), rec.current());
        assertTrue(store.snapshot(oldHead).isPresent(), "old head stays reachable");
    }

    @Test
    void history_is_newest_first_with_decreasing_timestamps() {
        UserRecord rec = store.createUser(A, List.of(), 0, true);
        store.appendNode(rec.id(), peers("B"), 10_000);
        store.appendNode(rec.id(), peers("B", "C"), 20_001);
        store.appendNode(rec.id(), peers("D"), 30_002);

        List<NodeSnapshot> chain = store.history(rec.id());
        assertEquals(4, chain.size());
        assertEquals(peers("B", "C"), chain.get(1).neighbors());
        for (int i = 1; i < chain.size(); i++) {
            assertTrue(chain.get(i - 1).timestampMillis() > chain.get(i).timestampMillis());
        }
        assertTrue(chain.get(3).isRoot());
    }

    @Test
    void append_rejects_non_increasing_timestamp() {
        UserRecord rec = store.createUser(A, List.of(), 5_000, true);
        int before = store.snapshotCount();

        assertThrows(IllegalStateException.class, () -> store.appendNode(rec.id(), peers("B"), 5_000));

        assertEquals(before, store.snapshotCount());
        assertEquals(new NodeContents(List.of(), 5_000), rec.current());
    }

    @Test
    void chains_of_different_users_are_independent() {
        UserRecord a = store.createUser(A, List.of(), 0, true);
        UserRecord b = store.createUser(B, peers("A"), 0, true);
        store.appendNode(a.id(), peers("B"), 10_000);

        assertEquals(2, store.history(a.id()).size());
        assertEquals(1, store.history(b.id()).size());
        assertEquals(List.of(A, B), store.registry().orElseThrow().registeredUsers());
    }

    @Test
    void unknown_user_is_reported() {
        assertThrows(NoSuchElementException.class, () -> store.appendNode("nope", List.of(), 1));
        assertThrows(NoSuchElementException.class, () -> store.history("nope"));
        assertTrue(store.user("nope").isEmpty());
    }

    @Test
    void create_user_requires_registry() {
        try (var fresh = new DurableGraphStore(
                new FileWal(walDir.resolve("other"), 1L << 60),
                new FileSnapshotter(snapDir.resolve("other")),
                new SnapshotPolicy(10))) {
            assertThrows(IllegalStateException.class, () -> fresh.createUser(A, List.of(), 0, true));
        }
    }
}
