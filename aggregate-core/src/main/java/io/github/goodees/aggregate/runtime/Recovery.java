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
import io.github.goodees.aggregate.store.PersistedEvent;
import io.github.goodees.aggregate.store.RecoveryStream;
import io.github.goodees.aggregate.store.Snapshot;

import java.util.Objects;
import java.util.Optional;

/**
 * Reconstructs lifecycle and state out of a {@link RecoveryStream}. Touches nothing but its own fields and the
 * event counter of the snapshot manager.
 *
 * @param <E> type of events
 * @param <S> type of aggregate state
 */
public class Recovery<E, S> implements RecoveryStream.Handler<E, S> {
    private final EventApplication<E, S> eventApplication;
    private final SnapshotManager<S> snapshotManager;

    private LifecycleState lifecycle = LifecycleState.UNINITIALIZED;
    private Optional<S> state = Optional.empty();
    private long lastSequenceNr;
    private boolean completed;

    public Recovery(EventApplication<E, S> eventApplication, SnapshotManager<S> snapshotManager) {
        this.eventApplication = Objects.requireNonNull(eventApplication);
        this.snapshotManager = Objects.requireNonNull(snapshotManager);
    }

    @Override
    public void snapshotOffer(Snapshot<S> snapshot) {
        state = snapshot.getState();
        lifecycle = snapshot.getLifecycle();
        lastSequenceNr = snapshot.getSequenceNr();
        snapshotManager.reset();
    }

    /**
     * Lifecycle becomes AVAILABLE only once the state is present, an update event ignored by an uninitialized
     * aggregate leaves it UNINITIALIZED.
     */
    @Override
    public void event(PersistedEvent<E> event) {
        state = eventApplication.apply(state, event.getPayload());
        lastSequenceNr = event.getSequenceNr();
        snapshotManager.eventReplayed();
        if (state.isPresent()) {
            lifecycle = LifecycleState.AVAILABLE;
        }
    }

    @Override
    public void recoveryCompleted(long highestSequenceNr) {
        lastSequenceNr = highestSequenceNr;
        completed = true;
    }

    public LifecycleState getLifecycle() {
        return lifecycle;
    }

    public Optional<S> getState() {
        return state;
    }

    public long getLastSequenceNr() {
        return lastSequenceNr;
    }

    public boolean isCompleted() {
        return completed;
    }
}
