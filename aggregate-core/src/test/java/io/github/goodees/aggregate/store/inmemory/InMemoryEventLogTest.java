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
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class InMemoryEventLogTest {
    private final InMemoryEventLog<String> log = new InMemoryEventLog<>();

    private static Throwable failureOf(EventLog<String> log, List<String> events) throws InterruptedException {
        try {
            log.appendAll("id", events).toCompletableFuture().get();
        } catch (ExecutionException e) {
            return e.getCause();
        }
        fail("Append should have failed");
        return null;
    }

    private List<Long> sequenceNumbers(String aggregateId, long after) {
        List<Long> result = new ArrayList<>();
        try (EventLog.StoredEvents<String> events = log.readEvents(aggregateId, after)) {
            events.foreach(e -> result.add(e.getSequenceNr()));
        }
        return result;
    }

    @Test
    public void sequence_numbers_are_contiguous_per_aggregate() throws Exception {
        assertEquals(Long.valueOf(2), log.appendAll("a", Arrays.asList("a1", "a2")).toCompletableFuture().get());
        assertEquals(Long.valueOf(1), log.append("b", "b1").toCompletableFuture().get());
        assertEquals(Long.valueOf(3), log.append("a", "a3").toCompletableFuture().get());

        assertEquals(3, log.highestSequenceNr("a"));
        assertEquals(1, log.highestSequenceNr("b"));
        assertEquals(0, log.highestSequenceNr("c"));
        assertThat(log.events("a"), contains("a1", "a2", "a3"));
        assertThat(sequenceNumbers("a", 0), contains(1L, 2L, 3L));
    }

    @Test
    public void events_are_read_after_given_sequence_number() throws Exception {
        log.appendAll("a", Arrays.asList("a1", "a2", "a3")).toCompletableFuture().get();

        assertThat(sequenceNumbers("a", 1), contains(2L, 3L));
        assertThat(sequenceNumbers("a", 3), empty());
    }

    @Test
    public void reading_can_be_stopped() throws Exception {
        log.appendAll("a", Arrays.asList("a1", "a2", "a3")).toCompletableFuture().get();

        try (EventLog.StoredEvents<String> events = log.readEvents("a", 0)) {
            String concatenated = events.reduce("", (acc, e) -> {
                if (e.getSequenceNr() == 2) {
                    events.stop();
                }
                return acc + e.getPayload();
            });
            assertEquals("a1a2", concatenated);
        }
    }

    @Test
    public void empty_batch_is_rejected() throws Exception {
        Throwable failure = failureOf(log, Collections.emptyList());
        assertThat(failure, instanceOf(EventStoreException.class));
        assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, ((EventStoreException) failure).getFault());
    }

    @Test
    public void batch_with_null_event_is_not_appended() throws Exception {
        log.append("id", "first").toCompletableFuture().get();

        assertThat(failureOf(log, Arrays.asList("second", null)), instanceOf(EventStoreException.class));
        assertEquals(1, log.highestSequenceNr("id"));
    }

    @Test
    public void persisted_event_carries_identity() throws Exception {
        log.append("id", "payload").toCompletableFuture().get();
        List<PersistedEvent<String>> read = new ArrayList<>();
        try (EventLog.StoredEvents<String> events = log.readEvents("id", 0)) {
            events.foreach(read::add);
        }
        assertEquals(1, read.size());
        assertEquals("id", read.get(0).getAggregateId());
        assertEquals("payload", read.get(0).getPayload());
    }
}
