// file: server/src/test/java/io/proxgraph/server/ProximityServiceSpec.java
package io.proxgraph.server;

import io.proxgraph.core.AlreadyRegisteredException;
import io.proxgraph.core.CapabilityMismatchException;
import io.proxgraph.core.ClockRegressionException;
import io.proxgraph.core.DevCapability;
import io.proxgraph.core.GraphEvent;
import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.NotOwnerException;
import io.proxgraph.core.PeerRef;
import io.proxgraph.core.SnapshotId;
import io.proxgraph.core.UpdateTooSoonException;
import io.proxgraph.storage.DurableGraphStore;
import io.proxgraph.storage.FileSnapshotter;
import io.proxgraph.storage.FileWal;
import io.proxgraph.storage.GraphImage;
import io.proxgraph.storage.SnapshotPolicy;
import io.proxgraph.storage.Snapshotter;
import io.proxgraph.storage.UserRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavioural specs for ProximityService on top of a real DurableGraphStore.
 *
 * Covers the normal path (register/update with ownership and the update gate)
 * and the dev path (synthetic users and updates behind the capability).
 */
class ProximityServiceSpec {

    private static final Identity DEPLOYER = Identity.of("deployer");
    private static final Identity A = Identity.of("A");
    private static final Identity D = Identity.of("D");

    @TempDir
    Path walDir;

    @TempDir
    Path snapDir;

    private DurableGraphStore store;
    private RecordingEventSink events;
    private ProximityService svc;
    private GraphHandles handles;

    @BeforeEach
    void setUp() {
        store = new DurableGraphStore(
                new FileWal(walDir, 1L << 60),
                new FileSnapshotter(snapDir),
                new SnapshotPolicy(1000)
        );
        events = new RecordingEventSink();
        handles = Bootstrap.init(store, DEPLOYER, events);
        svc = new ProximityService(store, events);
        events.clear();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static List<PeerRef> peers(String... ids) {
        return Arrays.stream(ids).map(PeerRef::of).toList();
    }

    // ---------- registration ----------

    @Test
    void register_creates_root_and_adds_identity_to_registry() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);

        assertEquals(List.of(), rec.current().neighbors());
        assertEquals(0L, rec.current().timestampMillis());
        assertEquals(A, rec.owner());
        assertFalse(rec.synthetic());
        assertEquals(List.of(A), svc.registry().registeredUsers());
        assertTrue(svc.snapshot(rec.head()).isRoot());
    }

    @Test
    void registering_twice_fails_and_leaves_registry_size_alone() {
        svc.registerUser(peers("B"), 0L, A);
        int snapshotsBefore = store.snapshotCount();

        var ex = assertThrows(AlreadyRegisteredException.class,
                () -> svc.registerUser(List.of(), 50_000L, A));

        assertEquals(A, ex.identity());
        assertEquals(1, svc.registry().size());
        assertEquals(1, svc.userCount());
        assertEquals(snapshotsBefore, store.snapshotCount());
    }

    @Test
    void register_emits_new_user_then_node_update() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);

        assertEquals(List.of(
                new GraphEvent.NewUser(A, rec.id()),
                new GraphEvent.NodeUpdate(rec.id(), rec.head())
        ), events.all());
    }

    @Test
    void concurrent_registration_of_one_identity_admits_exactly_one() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    try {
                        svc.registerUser(List.of(), 0L, A);
                        return true;
                    } catch (AlreadyRegisteredException e) {
                        return false;
                    }
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(10, TimeUnit.SECONDS)) winners++;
            }
            assertEquals(1, winners);
            assertEquals(1, svc.registry().size());
            assertEquals(1, svc.userCount());
        } finally {
            pool.shutdownNow();
        }
    }

    // ---------- update gate ----------

    @Test
    void update_before_interval_is_rejected() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);

        var ex = assertThrows(UpdateTooSoonException.class,
                () -> svc.updateNode(rec.id(), peers("B"), 5_000L, A));

        assertEquals(5_000L, ex.elapsedMillis());
        assertEquals(List.of(), rec.current().neighbors());
        assertEquals(1, svc.history(rec.id()).size());
    }

    @Test
    void update_at_exactly_the_interval_succeeds() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);
        SnapshotId root = rec.head();

        NodeSnapshot next = svc.updateNode(rec.id(), peers("B"), 10_000L, A);

        assertEquals(peers("B"), rec.current().neighbors());
        assertEquals(10_000L, rec.current().timestampMillis());
        assertEquals(next.id(), rec.head());
        assertEquals(root, next.previous().orElseThrow());
        assertEquals(2, svc.history(rec.id()).size());
    }

    @Test
    void chain_of_four_keeps_every_snapshot_reachable() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);
        svc.updateNode(rec.id(), peers("B"), 10_000L, A);
        svc.updateNode(rec.id(), peers("B", "C"), 20_001L, A);
        svc.updateNode(rec.id(), peers("D"), 30_002L, A);

        List<NodeSnapshot> history = svc.history(rec.id());

        assertEquals(4, history.size());
        assertEquals(peers("D"), history.get(0).neighbors());
        // Second snapshot counting the head as the first.
        assertEquals(peers("B", "C"), history.get(1).neighbors());
        assertEquals(peers("B"), history.get(2).neighbors());
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i - 1).timestampMillis() > history.get(i).timestampMillis());
            assertEquals(history.get(i).id(), history.get(i - 1).previous().orElseThrow());
        }
        assertTrue(history.get(3).isRoot());
    }

    @Test
    void clock_regression_is_rejected_and_nothing_changes() {
        UserRecord rec = svc.registerUser(List.of(), 50_000L, A);
        events.clear();

        assertThrows(ClockRegressionException.class,
                () -> svc.updateNode(rec.id(), peers("B"), 40_000L, A));

        assertEquals(50_000L, rec.current().timestampMillis());
        assertTrue(events.all().isEmpty());
    }

    @Test
    void empty_neighbors_are_valid_on_update() {
        UserRecord rec = svc.registerUser(peers("B"), 0L, A);

        svc.updateNode(rec.id(), List.of(), 10_000L, A);

        assertEquals(List.of(), rec.current().neighbors());
    }

    @Test
    void successful_update_emits_node_update_for_new_head() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);
        events.clear();

        NodeSnapshot next = svc.updateNode(rec.id(), peers("B"), 10_000L, A);

        assertEquals(List.of(new GraphEvent.NodeUpdate(rec.id(), next.id())), events.all());
    }

    // ---------- ownership ----------

    @Test
    void update_by_other_identity_fails_and_record_is_unchanged() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);
        SnapshotId headBefore = rec.head();
        events.clear();

        var ex = assertThrows(NotOwnerException.class,
                () -> svc.updateNode(rec.id(), peers("X"), 10_000L, D));

        assertNotNull(ex.getMessage());
        assertEquals(headBefore, rec.head());
        assertEquals(List.of(), rec.current().neighbors());
        assertEquals(1, svc.history(rec.id()).size());
        assertTrue(events.all().isEmpty());
    }

    @Test
    void ownership_is_checked_before_the_gate() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);

        // Too soon AND wrong caller: the caller is rejected first.
        assertThrows(NotOwnerException.class,
                () -> svc.updateNode(rec.id(), peers("X"), 1L, D));
    }

    @Test
    void update_of_unknown_user_is_not_found() {
        assertThrows(java.util.NoSuchElementException.class,
                () -> svc.updateNode("no-such-user", List.of(), 10_000L, A));
    }

    // ---------- dev capability ----------

    @Test
    void spawn_by_non_holder_fails_and_changes_nothing() {
        svc.registerUser(List.of(), 0L, A);
        int registered = svc.registry().size();
        int snapshots = store.snapshotCount();
        int users = svc.userCount();
        events.clear();

        // D presents the real token id but does not hold it.
        DevCapability stolen = new DevCapability(handles.capability().id(), D);
        assertThrows(CapabilityMismatchException.class,
                () -> svc.spawnSyntheticUser(stolen, Identity.of("bot"), List.of(), 1_000L, D));

        assertEquals(registered, svc.registry().size());
        assertEquals(snapshots, store.snapshotCount());
        assertEquals(users, svc.userCount());
        assertTrue(events.all().isEmpty());
    }

    @Test
    void spawn_with_forged_token_id_fails_even_for_deployer() {
        DevCapability forged = new DevCapability("not-the-minted-id", DEPLOYER);

        assertThrows(CapabilityMismatchException.class,
                () -> svc.spawnSyntheticUser(forged, Identity.of("bot"), List.of(), 0L, DEPLOYER));
        assertEquals(0, svc.userCount());
    }

    @Test
    void synthetic_user_is_not_counted_in_registry() {
        UserRecord bot = svc.spawnSyntheticUser(handles.capability(), Identity.of("bot"), peers("A"), 0L, DEPLOYER);

        assertTrue(bot.synthetic());
        assertEquals(Identity.of("bot"), bot.owner());
        assertEquals(0, svc.registry().size());
        assertEquals(1, svc.userCount());
        assertEquals(2, events.all().size());
    }

    @Test
    void synthetic_identity_can_still_register_normally() {
        svc.spawnSyntheticUser(handles.capability(), Identity.of("bot"), List.of(), 0L, DEPLOYER);

        UserRecord real = svc.registerUser(List.of(), 0L, Identity.of("bot"));

        assertFalse(real.synthetic());
        assertEquals(List.of(Identity.of("bot")), svc.registry().registeredUsers());
        assertEquals(2, svc.userCount());
    }

    @Test
    void synthetic_update_advances_any_record_but_respects_the_gate() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);

        assertThrows(UpdateTooSoonException.class,
                () -> svc.syntheticUpdate(handles.capability(), rec.id(), peers("Z"), 9_999L, DEPLOYER));

        NodeSnapshot next = svc.syntheticUpdate(handles.capability(), rec.id(), peers("Z"), 10_000L, DEPLOYER);

        assertEquals(A, next.owner());
        assertEquals(next.id(), rec.head());
        assertEquals(peers("Z"), rec.current().neighbors());
    }

    @Test
    void synthetic_update_with_clock_behind_head_is_rejected() {
        UserRecord rec = svc.registerUser(peers("B"), 50_000L, A);
        SnapshotId headBefore = rec.head();
        events.clear();

        assertThrows(ClockRegressionException.class,
                () -> svc.syntheticUpdate(handles.capability(), rec.id(), peers("Z"), 40_000L, DEPLOYER));

        assertEquals(headBefore, rec.head());
        assertEquals(peers("B"), rec.current().neighbors());
        assertEquals(50_000L, rec.current().timestampMillis());
        assertEquals(1, svc.history(rec.id()).size());
        assertTrue(events.all().isEmpty());
    }

    @Test
    void synthetic_update_by_non_holder_fails() {
        UserRecord rec = svc.registerUser(List.of(), 0L, A);

        assertThrows(CapabilityMismatchException.class,
                () -> svc.syntheticUpdate(handles.capability(), rec.id(), peers("Z"), 10_000L, A));
        assertEquals(1, svc.history(rec.id()).size());
    }

    @Test
    void null_neighbor_is_rejected() {
        List<PeerRef> withNull = new ArrayList<>();
        withNull.add(null);

        assertThrows(IllegalArgumentException.class, () -> svc.registerUser(withNull, 0L, A));
        assertEquals(0, svc.registry().size());
    }

    // ---------- storage faults after commit ----------

    @Test
    void registration_reports_success_and_emits_when_snapshot_write_fails(@TempDir Path otherWal) {
        Snapshotter broken = new Snapshotter() {
            @Override
            public String writeSnapshot(GraphImage image) {
                throw new UncheckedIOException(new IOException("disk full"));
            }

            @Override
            public LoadedSnapshot loadLatest() {
                return null;
            }
        };
        var recorded = new RecordingEventSink();
        try (var faulty = new DurableGraphStore(new FileWal(otherWal, 1L << 60), broken, new SnapshotPolicy(2))) {
            Bootstrap.init(faulty, DEPLOYER, recorded);   // 1st record
            var service = new ProximityService(faulty, recorded);
            recorded.clear();

            UserRecord rec = service.registerUser(List.of(), 0L, A);   // 2nd record: snapshot attempt fails

            assertEquals(List.of(
                    new GraphEvent.NewUser(A, rec.id()),
                    new GraphEvent.NodeUpdate(rec.id(), rec.head())
            ), recorded.all());
            assertEquals(List.of(A), service.registry().registeredUsers());
        }
    }
}
