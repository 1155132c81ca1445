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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Durable, append only log of events, addressed by aggregate id.
 *
 * <p>The runtime guarantees that only one append for given aggregate is outstanding at any time. Serializing appends
 * of concurrent writers from other processes is responsibility of the implementation, e. g. by optimistic locking on
 * the sequence number.</p>
 *
 * @param <E> type of events
 */
public interface EventLog<E> {

    /**
     * Append single event.
     * @param aggregateId the id of an aggregate
     * @param event event to append
     * @return stage completing with sequence number of the event, or exceptionally with {@link EventStoreException}
     */
    default CompletionStage<Long> append(String aggregateId, E event) {
        return appendAll(aggregateId, Collections.singletonList(event));
    }

    /**
     * Append events in order. Either all of the events are stored, or none.
     * @param aggregateId the id of an aggregate
     * @param events events to append, not empty
     * @return stage completing with sequence number of the last event, or exceptionally with
     *         {@link EventStoreException}
     */
    CompletionStage<Long> appendAll(String aggregateId, List<? extends E> events);

    /**
     * Read all events for an aggregate recorded after specified sequence number.
     * @param aggregateId the id of an aggregate
     * @param afterSequenceNr events recorded after this one. 0 returns entire history
     * @return accessor for the events in order they were appended
     */
    StoredEvents<E> readEvents(String aggregateId, long afterSequenceNr);

    /**
     * Sequence number of the last event recorded for the aggregate.
     * @param aggregateId the id of an aggregate
     * @return sequence number of last event, 0 if there is none
     */
    long highestSequenceNr(String aggregateId);

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example wrap a
     * JDBC ResultSet. This also means that only one of methods foreach and reduce may be called on single instance, and
     * only once.
     */
    interface StoredEvents<E> extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super PersistedEvent<E>> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super PersistedEvent<E>, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
