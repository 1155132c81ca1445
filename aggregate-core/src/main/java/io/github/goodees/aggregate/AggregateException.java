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

/**
 * Command or query refused by the runtime itself, before or instead of asking the behavior.
 */
public class AggregateException extends Exception {
    private final Fault fault;
    private final String aggregateId;

    public enum Fault {
        NOT_INITIALIZED, ALREADY_INITIALIZED, PENDING_LIMIT_EXCEEDED, TERMINATED
    }

    protected AggregateException(Fault fault, String aggregateId, String message) {
        super(message);
        this.fault = fault;
        this.aggregateId = aggregateId;
    }

    public Fault getFault() {
        return fault;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public static AggregateException notInitialized(String aggregateId) {
        return new AggregateException(Fault.NOT_INITIALIZED, aggregateId, "Aggregate " + aggregateId
                + " not initialized");
    }

    public static AggregateException alreadyInitialized(String aggregateId, Object command) {
        return new AggregateException(Fault.ALREADY_INITIALIZED, aggregateId, "Aggregate " + aggregateId
                + " is already initialized, creation command rejected: " + command);
    }

    public static AggregateException pendingLimitExceeded(String aggregateId, int limit) {
        return new AggregateException(Fault.PENDING_LIMIT_EXCEEDED, aggregateId, "Aggregate " + aggregateId
                + " already has " + limit + " pending commands");
    }

    public static AggregateException terminated(String aggregateId) {
        return new AggregateException(Fault.TERMINATED, aggregateId, "Aggregate " + aggregateId
                + " was terminated before the command completed");
    }
}
