package io.github.goodees.aggregate.runtime;

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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration, as alternative to defining own implementation. Values are passed to constructor, or
 * derived from {@link #defaults()} via the {@code with} methods.
 */
public class SimpleAggregateConfiguration implements AggregateConfiguration {
    public static final int DEFAULT_SNAPSHOT_THRESHOLD = 10;
    public static final int DEFAULT_THROUGHPUT = 16;

    private static final SimpleAggregateConfiguration DEFAULTS = new SimpleAggregateConfiguration(
            DEFAULT_SNAPSHOT_THRESHOLD, Optional.empty(), 0, DEFAULT_THROUGHPUT);

    private final int snapshotThreshold;
    private final Optional<Duration> inactivityTimeout;
    private final int pendingCommandLimit;
    private final int throughput;

    /**
     * Create configuration.
     * @param snapshotThreshold events between snapshots, 0 to disable snapshots
     * @param inactivityTimeout time of inactivity before passivation
     * @param pendingCommandLimit bound of pending command queue, 0 for unbounded
     * @param throughput messages processed before yielding the thread
     */
    public SimpleAggregateConfiguration(int snapshotThreshold, Optional<Duration> inactivityTimeout,
            int pendingCommandLimit, int throughput) {
        if (snapshotThreshold < 0) {
            throw new IllegalArgumentException("Snapshot threshold cannot be negative");
        }
        if (pendingCommandLimit < 0) {
            throw new IllegalArgumentException("Pending command limit cannot be negative");
        }
        if (throughput < 1) {
            throw new IllegalArgumentException("Throughput must be positive");
        }
        this.inactivityTimeout = Objects.requireNonNull(inactivityTimeout, "Inactivity timeout must be specified");
        if (inactivityTimeout.isPresent()
                && (inactivityTimeout.get().isNegative() || inactivityTimeout.get().isZero())) {
            throw new IllegalArgumentException("Inactivity timeout must be positive");
        }
        this.snapshotThreshold = snapshotThreshold;
        this.pendingCommandLimit = pendingCommandLimit;
        this.throughput = throughput;
    }

    /**
     * Snapshot every 10 events, no passivation, unbounded pending queue.
     * @return default configuration
     */
    public static SimpleAggregateConfiguration defaults() {
        return DEFAULTS;
    }

    public SimpleAggregateConfiguration withSnapshotThreshold(int snapshotThreshold) {
        return new SimpleAggregateConfiguration(snapshotThreshold, inactivityTimeout, pendingCommandLimit,
            throughput);
    }

    public SimpleAggregateConfiguration withInactivityTimeout(Duration inactivityTimeout) {
        return new SimpleAggregateConfiguration(snapshotThreshold, Optional.of(inactivityTimeout),
            pendingCommandLimit, throughput);
    }

    public SimpleAggregateConfiguration withoutInactivityTimeout() {
        return new SimpleAggregateConfiguration(snapshotThreshold, Optional.empty(), pendingCommandLimit,
            throughput);
    }

    public SimpleAggregateConfiguration withPendingCommandLimit(int pendingCommandLimit) {
        return new SimpleAggregateConfiguration(snapshotThreshold, inactivityTimeout, pendingCommandLimit,
            throughput);
    }

    public SimpleAggregateConfiguration withThroughput(int throughput) {
        return new SimpleAggregateConfiguration(snapshotThreshold, inactivityTimeout, pendingCommandLimit,
            throughput);
    }

    @Override
    public int snapshotThreshold() {
        return snapshotThreshold;
    }

    @Override
    public Optional<Duration> inactivityTimeout() {
        return inactivityTimeout;
    }

    @Override
    public int pendingCommandLimit() {
        return pendingCommandLimit;
    }

    @Override
    public int throughput() {
        return throughput;
    }

    @Override
    public String toString() {
        return "SimpleAggregateConfiguration{snapshotThreshold=" + snapshotThreshold + ", inactivityTimeout="
                + inactivityTimeout + ", pendingCommandLimit=" + pendingCommandLimit + ", throughput=" + throughput
                + '}';
    }
}
