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

import java.util.Objects;

/**
 * Snapshot store keeping the state as String payload produced by a {@link Serialization}.
 * @param <S> type of aggregate state
 */
public abstract class SnapshotStoreWithSerialization<S> extends SnapshotStore<S, String> {
    protected final Serialization<S> serialization;

    protected SnapshotStoreWithSerialization(Serialization<S> serialization) {
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
    }

    @Override
    protected S deserializeSnapshot(SnapshotRecord snapshotRecord) {
        String payload = snapshotRecord.getPayload();
        if (payload == null) {
            return null;
        }
        return serialization.deserialize(snapshotRecord.getHeader().payloadVersion(), payload);
    }

    @Override
    protected SnapshotRecord serializeSnapshot(Snapshot<S> snapshot) {
        String payload = null;
        int payloadVersion = 0;
        if (snapshot.getState().isPresent()) {
            S state = snapshot.getState().get();
            payload = serialization.serialize(state);
            payloadVersion = serialization.payloadVersion(state);
        }
        return new SnapshotRecord(new SnapshotMetadata.Default(snapshot.getAggregateId(), snapshot.getTimestamp(),
            payloadVersion, snapshot.getSequenceNr(), snapshot.getLifecycle()), payload);
    }
}
