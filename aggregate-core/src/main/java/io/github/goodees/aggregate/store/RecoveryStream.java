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
import java.util.Optional;

/**
 * The sequence an aggregate is recovered from: an optional snapshot offer, followed by all events recorded after the
 * snapshot (or the entire history when there is no snapshot), terminated by completion of recovery.
 *
 * @param <E> type of events
 * @param <S> type of aggregate state
 */
public final class RecoveryStream<E, S> {
    private final String aggregateId;
    private final EventLog<E> eventLog;
    private final SnapshotStore<S, ?> snapshotStore;

    private RecoveryStream(String aggregateId, EventLog<E> eventLog, SnapshotStore<S, ?> snapshotStore) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be specified");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
    }

    public static <E, S> RecoveryStream<E, S> of(String aggregateId, EventLog<E> eventLog,
            SnapshotStore<S, ?> snapshotStore) {
        return new RecoveryStream<>(aggregateId, eventLog, snapshotStore);
    }

    /**
     * Feed the stream into the handler. Runs in the calling thread, and returns after
     * {@link Handler#recoveryCompleted(long)} was called.
     * @param handler receiver of the stream
     */
    public void replay(Handler<E, S> handler) {
        Optional<Snapshot<S>> snapshot = snapshotStore.readSnapshot(aggregateId);
        long afterSequenceNr = 0;
        if (snapshot.isPresent()) {
            handler.snapshotOffer(snapshot.get());
            afterSequenceNr = snapshot.get().getSequenceNr();
        }
        Long last;
        try (EventLog.StoredEvents<E> events = eventLog.readEvents(aggregateId, afterSequenceNr)) {
            last = events.reduce(afterSequenceNr, (highest, event) -> {
                handler.event(event);
                return event.getSequenceNr();
            });
        }
        handler.recoveryCompleted(last);
    }

    /**
     * Receiver of recovery stream.
     * @param <E> type of events
     * @param <S> type of aggregate state
     */
    public interface Handler<E, S> {
        /**
         * Most recent snapshot of the aggregate. Called at most once, before any event.
         * @param snapshot the snapshot
         */
        void snapshotOffer(Snapshot<S> snapshot);

        /**
         * Next event in order of the log.
         * @param event recorded event
         */
        void event(PersistedEvent<E> event);

        /**
         * End of recovery.
         * @param highestSequenceNr sequence number of the last event folded into recovered state
         */
        void recoveryCompleted(long highestSequenceNr);
    }
}
