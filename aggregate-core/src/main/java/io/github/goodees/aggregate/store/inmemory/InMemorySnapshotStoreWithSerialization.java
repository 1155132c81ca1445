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

import io.github.goodees.aggregate.LifecycleState;
import io.github.goodees.aggregate.store.Serialization;
import io.github.goodees.aggregate.store.SnapshotMetadata;
import io.github.goodees.aggregate.store.SnapshotStoreWithSerialization;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * InMemoryStore, that also exercises serialization.
 * @param <S> type of aggregate state
 */
public class InMemorySnapshotStoreWithSerialization<S> extends SnapshotStoreWithSerialization<S> {
    private final ConcurrentMap<String, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();

    public InMemorySnapshotStoreWithSerialization(Serialization<S> serialization) {
        super(serialization);
    }

    @Override
    protected SnapshotRecord retrieveSnapshotRecord(String aggregateId) {
        return snapshotRecords.get(aggregateId);
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        snapshotRecords.put(snapshotRecord.getHeader().aggregateId(), snapshotRecord);
    }

    public Optional<String> getSerializedSnapshot(String aggregateId) {
        return Optional.ofNullable(retrieveSnapshotRecord(aggregateId)).map(SnapshotRecord::getPayload);
    }

    public OptionalInt getSerializedSnapshotVersion(String aggregateId) {
        SnapshotRecord record = retrieveSnapshotRecord(aggregateId);
        if (record != null) {
            return OptionalInt.of(record.getHeader().payloadVersion());
        } else {
            return OptionalInt.empty();
        }
    }

    /**
     * Put a raw payload into the store, e. g. one written by past version of the serialization.
     * @param aggregateId the id of an aggregate
     * @param sequenceNr sequence number of last event included in the payload
     * @param payloadVersion version of the payload
     * @param payload serialized state
     */
    public void storeSnapshot(String aggregateId, long sequenceNr, int payloadVersion, String payload) {
        storeSnapshotRecord(new SnapshotRecord(new SnapshotMetadata.Default(aggregateId, Instant.now(), payloadVersion,
            sequenceNr, LifecycleState.accepting(payload != null)), payload));
    }
}
