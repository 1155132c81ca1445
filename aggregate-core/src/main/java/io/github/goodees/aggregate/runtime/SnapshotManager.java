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

import io.github.goodees.aggregate.store.Snapshot;
import io.github.goodees.aggregate.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Counts events applied since last snapshot and stores a snapshot once the count reaches the threshold. Saving is
 * fire and forget, its outcome is only logged.
 * <p>Not thread safe, only the worker owning the aggregate calls it.</p>
 *
 * @param <S> type of aggregate state
 */
public class SnapshotManager<S> {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotManager.class);

    private final String aggregateId;
    private final SnapshotStore<S, ?> snapshotStore;
    private final int threshold;
    private int eventsSinceSnapshot;

    /**
     * Create the manager.
     * @param aggregateId the id of managed aggregate
     * @param snapshotStore store to save snapshots into
     * @param threshold number of events between snapshots, 0 or less to never snapshot
     */
    public SnapshotManager(String aggregateId, SnapshotStore<S, ?> snapshotStore, int threshold) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
        this.threshold = threshold;
    }

    /**
     * An event was replayed during recovery. Counts, but never snapshots.
     */
    public void eventReplayed() {
        eventsSinceSnapshot++;
    }

    /**
     * Recovery started from a snapshot.
     */
    public void reset() {
        eventsSinceSnapshot = 0;
    }

    /**
     * A live event was persisted and applied.
     * @param sequenceNr sequence number of the event
     * @param state state after the event was applied
     * @return true if snapshot save was triggered
     */
    public boolean eventPersisted(long sequenceNr, Optional<S> state) {
        eventsSinceSnapshot++;
        if (threshold > 0 && eventsSinceSnapshot >= threshold) {
            eventsSinceSnapshot = 0;
            save(Snapshot.of(aggregateId, sequenceNr, state));
            return true;
        }
        return false;
    }

    public int eventsSinceSnapshot() {
        return eventsSinceSnapshot;
    }

    private void save(Snapshot<S> snapshot) {
        CompletionStage<Void> saved;
        try {
            saved = snapshotStore.save(snapshot);
        } catch (RuntimeException e) {
            logger.warn("Failed to save {}", snapshot, e);
            return;
        }
        saved.whenComplete((result, failure) -> {
            if (failure != null) {
                logger.warn("Failed to save {}", snapshot, failure);
            } else {
                logger.debug("Saved {}", snapshot);
            }
        });
    }
}
