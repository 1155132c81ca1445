package io.github.goodees.aggregate.store;

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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle and aggregate state with all events up to {@link #getSequenceNr()} folded in. Replaying the events
 * recorded after that sequence number onto the snapshot yields the same state as replaying the entire stream.
 * @param <S> type of aggregate state
 */
public final class Snapshot<S> {
    private final String aggregateId;
    private final long sequenceNr;
    private final LifecycleState lifecycle;
    private final Optional<S> state;
    private final Instant timestamp;

    public Snapshot(String aggregateId, long sequenceNr, LifecycleState lifecycle, Optional<S> state,
            Instant timestamp) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.sequenceNr = sequenceNr;
        this.lifecycle = Objects.requireNonNull(lifecycle);
        this.state = Objects.requireNonNull(state);
        this.timestamp = Objects.requireNonNull(timestamp);
        if (lifecycle != LifecycleState.accepting(state.isPresent())) {
            throw new IllegalArgumentException("Snapshot of " + aggregateId + " cannot be in lifecycle " + lifecycle
                    + (state.isPresent() ? " with state" : " without state"));
        }
    }

    /**
     * Snapshot of current state taken now. The lifecycle is derived from presence of the state, a snapshot never
     * records an aggregate in the middle of processing a command.
     * @param aggregateId id of the aggregate
     * @param sequenceNr sequence number of the last event applied to the state
     * @param state current state
     * @param <S> type of state
     * @return the snapshot
     */
    public static <S> Snapshot<S> of(String aggregateId, long sequenceNr, Optional<S> state) {
        return new Snapshot<>(aggregateId, sequenceNr, LifecycleState.accepting(state.isPresent()), state,
            Instant.now());
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getSequenceNr() {
        return sequenceNr;
    }

    public LifecycleState getLifecycle() {
        return lifecycle;
    }

    public Optional<S> getState() {
        return state;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Snapshot{" + aggregateId + "#" + sequenceNr + ", " + lifecycle + ", state=" + state + '}';
    }
}
