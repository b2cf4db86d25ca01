// file: server/src/main/java/io/proxgraph/server/Bootstrap.java
package io.proxgraph.server;

import io.proxgraph.core.DevCapability;
import io.proxgraph.core.EventSink;
import io.proxgraph.core.GraphEvent;
import io.proxgraph.core.Identity;
import io.proxgraph.storage.GraphStore;
import io.proxgraph.storage.IdentityRegistry;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * One-time deployment step: create the registry and mint the dev capability.
 * <p>
 * On a store that already holds a registry (a restart) nothing is created or
 * emitted; the persisted handles are returned to the original deployer.
 */
public final class Bootstrap {
    private static final Logger log = Logger.getLogger(Bootstrap.class.getName());

    private Bootstrap() {
        // utility
    }

    /**
     * @throws IllegalStateException if the store was initialised by a different deployer
     */
    public static synchronized GraphHandles init(GraphStore store, Identity deployer, EventSink events) {
        Optional<IdentityRegistry> existing = store.registry();
        if (existing.isPresent()) {
            IdentityRegistry reg = existing.get();
            if (!reg.creator().equals(deployer)) {
                throw new IllegalStateException("registry " + reg.id() + " was deployed by "
                        + reg.creator() + ", not " + deployer);
            }
            DevCapability cap = store.capability()
                    .orElseThrow(() -> new IllegalStateException("registry without capability"));
            log.info("registry " + reg.id() + " already initialised; " + reg.size() + " registered users");
            return new GraphHandles(reg.id(), cap);
        }

        GraphStore.Genesis genesis = store.initRegistry(deployer);
        events.emit(new GraphEvent.RegistryCreated(genesis.registry().id(), deployer));
        log.info("created registry " + genesis.registry().id() + " for " + deployer);
        return new GraphHandles(genesis.registry().id(), genesis.capability());
    }
}
