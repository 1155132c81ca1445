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

/**
 * Header data of a snapshot.
 */
public interface SnapshotMetadata {
    /**
     * Identity of the aggregate.
     * @return identity
     */
    String aggregateId();

    /**
     * Timestamp of the snapshot
     * @return the time when snapshot was created
     */
    Instant getTimestamp();

    /**
     * Payload version
     * @return version of serialization used for the payload
     */
    int payloadVersion();

    /**
     * Sequence number of the last event folded into the snapshot.
     * @return the sequence number
     */
    long sequenceNr();

    /**
     * Lifecycle of the aggregate at the time of the snapshot.
     * @return lifecycle state, never {@link LifecycleState#BUSY}
     */
    LifecycleState lifecycle();

    class Default implements SnapshotMetadata {

        private final String aggregateId;
        private final Instant timestamp;
        private final int payloadVersion;
        private final long sequenceNr;
        private final LifecycleState lifecycle;

        public Default(String aggregateId, Instant timestamp, int payloadVersion, long sequenceNr,
                LifecycleState lifecycle) {
            this.aggregateId = aggregateId;
            this.timestamp = timestamp;
            this.payloadVersion = payloadVersion;
            this.sequenceNr = sequenceNr;
            this.lifecycle = lifecycle;
        }

        @Override
        public String aggregateId() {
            return aggregateId;
        }

        @Override
        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public int payloadVersion() {
            return payloadVersion;
        }

        @Override
        public long sequenceNr() {
            return sequenceNr;
        }

        @Override
        public LifecycleState lifecycle() {
            return lifecycle;
        }
    }
}
