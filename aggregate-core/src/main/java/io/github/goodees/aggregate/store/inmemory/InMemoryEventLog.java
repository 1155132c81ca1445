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

import io.github.goodees.aggregate.store.EventLog;
import io.github.goodees.aggregate.store.EventStoreException;
import io.github.goodees.aggregate.store.PersistedEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Keeps the events in memory. Appends complete synchronously.
 * @param <E> type of events
 */
public class InMemoryEventLog<E> implements EventLog<E> {
    private final ConcurrentMap<String, List<PersistedEvent<E>>> storage = new ConcurrentHashMap<>();

    @Override
    public CompletionStage<Long> appendAll(String aggregateId, List<? extends E> events) {
        CompletableFuture<Long> result = new CompletableFuture<>();
        try {
            result.complete(store(aggregateId, events));
        } catch (EventStoreException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Synchronously append the events.
     * @param aggregateId the id of an aggregate
     * @param events events to append
     * @return sequence number of the last appended event
     * @throws EventStoreException when there are no events to append
     */
    protected long store(String aggregateId, List<? extends E> events) throws EventStoreException {
        if (events.isEmpty()) {
            throw EventStoreException.emptyBatch(aggregateId);
        }
        List<PersistedEvent<E>> entityLog = entityLog(aggregateId);
        //ad SynchronizedList - the batch must not interleave with other appends
        synchronized (entityLog) {
            long sequenceNr = entityLog.size();
            Instant now = Instant.now();
            List<PersistedEvent<E>> batch = new ArrayList<>(events.size());
            for (E event : events) {
                if (event == null) {
                    throw EventStoreException.unsupported(aggregateId, null);
                }
                batch.add(new PersistedEvent<>(aggregateId, ++sequenceNr, now, event));
            }
            entityLog.addAll(batch);
            return sequenceNr;
        }
    }

    @Override
    public long highestSequenceNr(String aggregateId) {
        return entityLog(aggregateId).size();
    }

    /**
     * Payloads of all events of an aggregate.
     * @param aggregateId the id of an aggregate
     * @return copy of events in order of appending
     */
    public List<E> events(String aggregateId) {
        List<PersistedEvent<E>> events = entityLog(aggregateId);
        synchronized (events) {
            return events.stream().map(PersistedEvent::getPayload).collect(toList());
        }
    }

    private List<PersistedEvent<E>> entityLog(String aggregateId) {
        return storage.computeIfAbsent(aggregateId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public StoredEvents<E> readEvents(String aggregateId, long afterSequenceNr) {
        return new StoredEvents<E>() {
            final List<PersistedEvent<E>> filteredEvents;
            boolean stop = false;

            {
                List<PersistedEvent<E>> events = entityLog(aggregateId);
                //ad SynchronizedList - It is imperative that the user manually synchronize on the returned list when iterating over it.
                synchronized (events) {
                    filteredEvents = events.stream().filter(e -> e.getSequenceNr() > afterSequenceNr)
                        .collect(toList());
                }
            }

            @Override
            public void foreach(Consumer<? super PersistedEvent<E>> consumer) {
                for (PersistedEvent<E> event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super PersistedEvent<E>, R> reducer) {
                R result = initial;
                for (PersistedEvent<E> event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
