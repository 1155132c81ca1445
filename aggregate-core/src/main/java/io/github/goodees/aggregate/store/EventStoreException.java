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

/**
 * Exception generated when appending events to the log fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException optimisticLock(String aggregateId, long expectedSequenceNr,
            long actualSequenceNr) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateId + " expected to append after "
                + expectedSequenceNr + " while last known sequence number is " + actualSequenceNr, null);
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException emptyBatch(String aggregateId) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Attempted to append no events to aggregate "
                + aggregateId, null);
    }

    public static EventStoreException unsupported(String aggregateId, Object event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event for aggregate " + aggregateId
                + ": " + event, null);
    }
}
