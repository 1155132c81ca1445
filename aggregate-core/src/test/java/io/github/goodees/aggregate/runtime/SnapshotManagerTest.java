package io.github.goodees.aggregate.runtime;

/*-
 * #%L
 * aggregate-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.aggregate.LifecycleState;
import io.github.goodees.aggregate.store.Snapshot;
import io.github.goodees.aggregate.store.inmemory.InMemorySnapshotStore;
import org.junit.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SnapshotManagerTest {
    private final InMemorySnapshotStore<String> store = new InMemorySnapshotStore<>();

    @Test
    public void snapshot_is_taken_every_threshold_events() {
        SnapshotManager<String> manager = new SnapshotManager<>("id", store, 2);

        assertFalse(manager.eventPersisted(1, Optional.of("a")));
        assertTrue(manager.eventPersisted(2, Optional.of("ab")));
        assertEquals(0, manager.eventsSinceSnapshot());
        assertEquals(2, store.getSnapshottedSequenceNr("id"));
        assertFalse(manager.eventPersisted(3, Optional.of("abc")));
        assertTrue(manager.eventPersisted(4, Optional.of("abcd")));

        Snapshot<String> snapshot = store.readSnapshot("id").get();
        assertEquals(4, snapshot.getSequenceNr());
        assertEquals(Optional.of("abcd"), snapshot.getState());
        assertEquals(LifecycleState.AVAILABLE, snapshot.getLifecycle());
    }

    @Test
    public void replayed_events_count_towards_threshold_but_never_snapshot() {
        SnapshotManager<String> manager = new SnapshotManager<>("id", store, 3);

        manager.eventReplayed();
        manager.eventReplayed();
        manager.eventReplayed();
        assertEquals(3, manager.eventsSinceSnapshot());
        assertEquals(0, store.getSnapshottedSequenceNr("id"));

        assertTrue(manager.eventPersisted(4, Optional.of("abcd")));
    }

    @Test
    public void reset_restarts_counting() {
        SnapshotManager<String> manager = new SnapshotManager<>("id", store, 2);
        manager.eventReplayed();
        manager.reset();

        assertFalse(manager.eventPersisted(1, Optional.of("a")));
    }

    @Test
    public void zero_threshold_disables_snapshots() {
        SnapshotManager<String> manager = new SnapshotManager<>("id", store, 0);
        for (int i = 1; i <= 100; i++) {
            assertFalse(manager.eventPersisted(i, Optional.of("x")));
        }
        assertFalse(store.readSnapshot("id").isPresent());
    }

    @Test
    public void failed_save_does_not_propagate() {
        InMemorySnapshotStore<String> failingStore = new InMemorySnapshotStore<String>() {
            @Override
            public CompletionStage<Void> save(Snapshot<String> snapshot) {
                CompletableFuture<Void> result = new CompletableFuture<>();
                result.completeExceptionally(new IllegalStateException("store is down"));
                return result;
            }
        };
        SnapshotManager<String> manager = new SnapshotManager<>("id", failingStore, 1);

        assertTrue(manager.eventPersisted(1, Optional.of("a")));
        assertEquals(0, manager.eventsSinceSnapshot());
    }
}
