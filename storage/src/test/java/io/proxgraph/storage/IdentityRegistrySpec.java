// file: storage/src/test/java/io/proxgraph/storage/IdentityRegistrySpec.java
package io.proxgraph.storage;

import io.proxgraph.core.AlreadyRegisteredException;
import io.proxgraph.core.Identity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IdentityRegistrySpec {

    @Test
    void keeps_insertion_order_and_rejects_duplicates() {
        var reg = new IdentityRegistry("r", Identity.of("deployer"));
        reg.register(Identity.of("b"));
        reg.register(Identity.of("a"));

        assertThrows(AlreadyRegisteredException.class, () -> reg.register(Identity.of("b")));
        assertEquals(List.of(Identity.of("b"), Identity.of("a")), reg.registeredUsers());
    }

    @Test
    void racing_registrations_of_one_identity_yield_exactly_one_success() throws Exception {
        var reg = new IdentityRegistry("r", Identity.of("deployer"));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        reg.register(Identity.of("same"));
                        return true;
                    } catch (AlreadyRegisteredException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int ok = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) ok++;
            }
            assertEquals(1, ok);
            assertEquals(1, reg.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
