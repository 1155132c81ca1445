package io.github.goodees.aggregate.store.inmemory;

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
import io.github.goodees.aggregate.store.SnapshotMetadata;
import io.github.goodees.aggregate.store.SnapshotStore;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Stores snapshots in memory, keeping the state object itself as payload. It doesn't make much sense to use it outside
 * tests, but when an aggregate doesn't need durable snapshots it's good one to use.
 * @param <S> type of aggregate state
 */
public class InMemorySnapshotStore<S> extends SnapshotStore<S, S> {
    private final ConcurrentMap<String, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();

    @Override
    protected S deserializeSnapshot(SnapshotRecord snapshotRecord) {
        return snapshotRecord.getPayload();
    }

    @Override
    protected SnapshotRecord serializeSnapshot(Snapshot<S> snapshot) {
        return new SnapshotRecord(new SnapshotMetadata.Default(snapshot.getAggregateId(), snapshot.getTimestamp(), 1,
            snapshot.getSequenceNr(), snapshot.getLifecycle()), snapshot.getState().orElse(null));
    }

    @Override
    protected SnapshotRecord retrieveSnapshotRecord(String aggregateId) {
        return snapshotRecords.get(aggregateId);
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        snapshotRecords.put(snapshotRecord.getHeader().aggregateId(), snapshotRecord);
    }

    /**
     * Sequence number of the stored snapshot.
     * @param aggregateId the id of an aggregate
     * @return sequence number of the last event included in the snapshot, 0 if there is no snapshot
     */
    public long getSnapshottedSequenceNr(String aggregateId) {
        SnapshotRecord record = retrieveSnapshotRecord(aggregateId);
        return record == null ? 0 : record.getHeader().sequenceNr();
    }
}
