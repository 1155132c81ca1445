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

import java.time.Instant;
import java.util.Objects;

/**
 * An event as recorded in the log, together with the metadata the log keeps outside of the payload.
 * @param <E> type of event payload
 */
public final class PersistedEvent<E> {
    private final String aggregateId;
    private final long sequenceNr;
    private final Instant timestamp;
    private final E payload;

    public PersistedEvent(String aggregateId, long sequenceNr, Instant timestamp, E payload) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.sequenceNr = sequenceNr;
        this.timestamp = Objects.requireNonNull(timestamp);
        this.payload = Objects.requireNonNull(payload);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Position of the event within the stream of its aggregate. The first event has sequence number 1, and there are
     * no gaps.
     * @return sequence number
     */
    public long getSequenceNr() {
        return sequenceNr;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public E getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "PersistedEvent{" + aggregateId + "#" + sequenceNr + ", payload=" + payload + '}';
    }
}
