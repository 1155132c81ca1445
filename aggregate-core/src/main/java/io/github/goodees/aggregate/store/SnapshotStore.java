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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Common logic for storing snapshots. Subclasses decide how a snapshot is turned into a payload and where the
 * payload is kept. Only the most recent snapshot of an aggregate is ever read.
 *
 * @param <S> type of aggregate state
 * @param <P> the type of payload. Most likely String.
 */
public abstract class SnapshotStore<S, P> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * Read the most recent snapshot of an aggregate. A snapshot that cannot be retrieved or deserialized is
     * treated as missing, and the aggregate will be recovered from entire event stream.
     * @param aggregateId the identity of the aggregate
     * @return the snapshot if any usable is present
     */
    public Optional<Snapshot<S>> readSnapshot(String aggregateId) {
        try {
            SnapshotRecord snapshotRecord = retrieveSnapshotRecord(aggregateId);
            if (snapshotRecord != null) {
                SnapshotMetadata header = snapshotRecord.getHeader();
                Optional<S> state = Optional.ofNullable(deserializeSnapshot(snapshotRecord));
                return Optional.of(new Snapshot<>(aggregateId, header.sequenceNr(), header.lifecycle(), state,
                    header.getTimestamp()));
            }
        } catch (Exception e) {
            logger.error("Failure during deserialization of snapshot of {}", aggregateId, e);
        }
        return Optional.empty();
    }

    /**
     * Store the snapshot. Previous snapshot of the aggregate is superseded.
     *
     * @param snapshot snapshot to store
     * @return stage completing when the snapshot is stored, or exceptionally when storing failed
     * @see #serializeSnapshot(Snapshot)
     * @see #storeSnapshotRecord(SnapshotRecord)
     */
    public CompletionStage<Void> save(Snapshot<S> snapshot) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        try {
            storeSnapshotRecord(serializeSnapshot(snapshot));
            result.complete(null);
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Transform stored payload into aggregate state. Implementation will decide on header value, most
     * notably {@link SnapshotMetadata#payloadVersion()} on how to deserialize it.
     *
     * @param snapshotRecord the retrieved snapshot record
     * @return the state, or null if the snapshot was taken of an uninitialized aggregate
     */
    protected abstract S deserializeSnapshot(SnapshotRecord snapshotRecord);

    /**
     * Serialize a snapshot.
     *
     * @param snapshot snapshot to serialize
     * @return header data and payload of the snapshot
     */
    protected abstract SnapshotRecord serializeSnapshot(Snapshot<S> snapshot);

    /**
     * Retrieve most recent snapshot for an aggregate from store.
     *
     * @param aggregateId the identity of an aggregate
     * @return header and payload of the snapshot, null if there is none
     */
    protected abstract SnapshotRecord retrieveSnapshotRecord(String aggregateId);

    /**
     * Actually commit the snapshot record into underlying storage.
     *
     * @param snapshotRecord the record to store.
     */
    protected abstract void storeSnapshotRecord(SnapshotRecord snapshotRecord);

    /**
     * The record about a snapshot.
     */
    protected class SnapshotRecord {
        protected final SnapshotMetadata header;
        protected final P payload;

        /**
         * Create new record
         *
         * @param header  header
         * @param payload payload, null for snapshot of uninitialized aggregate
         */
        public SnapshotRecord(SnapshotMetadata header, P payload) {
            this.header = header;
            this.payload = payload;
        }

        public SnapshotMetadata getHeader() {
            return header;
        }

        public P getPayload() {
            return payload;
        }
    }

}
