package io.github.goodees.aggregate;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Successful outcome of a command: the events that were persisted and applied because of it.
 * @param <E> type of events
 */
public final class CommandResult<E> {
    private final String aggregateId;
    private final List<E> events;
    private final long lastSequenceNr;

    public CommandResult(String aggregateId, List<? extends E> events, long lastSequenceNr) {
        this.aggregateId = aggregateId;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.lastSequenceNr = lastSequenceNr;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Events in order they were persisted. Empty when the command was accepted without producing any.
     * @return persisted events
     */
    public List<E> getEvents() {
        return events;
    }

    /**
     * Sequence number of the last event of the aggregate after this command has been applied.
     * @return sequence number of last persisted event
     */
    public long getLastSequenceNr() {
        return lastSequenceNr;
    }

    @Override
    public String toString() {
        return "CommandResult{aggregateId=" + aggregateId + ", events=" + events + ", lastSequenceNr="
                + lastSequenceNr + '}';
    }
}
