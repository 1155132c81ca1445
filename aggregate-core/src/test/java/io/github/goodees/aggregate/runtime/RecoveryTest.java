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
import io.github.goodees.aggregate.bank.Account;
import io.github.goodees.aggregate.bank.AccountEvent;
import io.github.goodees.aggregate.bank.Accounts;
import io.github.goodees.aggregate.bank.Deposited;
import io.github.goodees.aggregate.bank.Opened;
import io.github.goodees.aggregate.store.PersistedEvent;
import io.github.goodees.aggregate.store.Snapshot;
import io.github.goodees.aggregate.store.inmemory.InMemorySnapshotStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RecoveryTest {
    private SnapshotManager<Account> snapshotManager;
    private Recovery<AccountEvent, Account> recovery;

    @Before
    public void setUp() {
        snapshotManager = new SnapshotManager<>("account", new InMemorySnapshotStore<>(), 10);
        recovery = new Recovery<>(new EventApplication<>("account", Accounts.behavior()), snapshotManager);
    }

    private static PersistedEvent<AccountEvent> event(long sequenceNr, AccountEvent payload) {
        return new PersistedEvent<>("account", sequenceNr, Instant.now(), payload);
    }

    @Test
    public void empty_stream_recovers_uninitialized_aggregate() {
        recovery.recoveryCompleted(0);

        assertTrue(recovery.isCompleted());
        assertEquals(LifecycleState.UNINITIALIZED, recovery.getLifecycle());
        assertFalse(recovery.getState().isPresent());
        assertEquals(0, recovery.getLastSequenceNr());
    }

    @Test
    public void events_are_folded_into_state() {
        recovery.event(event(1, Opened.of("alice", 1)));
        recovery.event(event(2, Deposited.of(2)));
        recovery.recoveryCompleted(2);

        assertEquals(LifecycleState.AVAILABLE, recovery.getLifecycle());
        assertEquals(Optional.of(new Account("alice", 3)), recovery.getState());
        assertEquals(2, recovery.getLastSequenceNr());
        assertEquals(2, snapshotManager.eventsSinceSnapshot());
    }

    @Test
    public void snapshot_is_the_starting_point() {
        snapshotManager.eventReplayed();
        recovery.snapshotOffer(Snapshot.of("account", 5, Optional.of(new Account("alice", 10))));
        recovery.event(event(6, Deposited.of(5)));
        recovery.recoveryCompleted(6);

        assertEquals(LifecycleState.AVAILABLE, recovery.getLifecycle());
        assertEquals(Optional.of(new Account("alice", 15)), recovery.getState());
        assertEquals(6, recovery.getLastSequenceNr());
        assertEquals(1, snapshotManager.eventsSinceSnapshot());
    }

    @Test
    public void snapshot_of_uninitialized_aggregate_keeps_it_uninitialized() {
        recovery.snapshotOffer(Snapshot.<Account>of("account", 0, Optional.empty()));
        recovery.recoveryCompleted(0);

        assertEquals(LifecycleState.UNINITIALIZED, recovery.getLifecycle());
        assertFalse(recovery.getState().isPresent());
    }

    @Test
    public void ignored_update_event_keeps_aggregate_uninitialized() {
        recovery.event(event(1, Deposited.of(2)));
        recovery.recoveryCompleted(1);

        assertEquals(LifecycleState.UNINITIALIZED, recovery.getLifecycle());
        assertFalse(recovery.getState().isPresent());
        assertEquals(1, recovery.getLastSequenceNr());
    }
}
