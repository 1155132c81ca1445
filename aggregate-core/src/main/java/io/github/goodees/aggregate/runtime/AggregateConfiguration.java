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
import java.util.Optional;

/**
 * Tunables of aggregate workers.
 */
public interface AggregateConfiguration {
    /**
     * Number of events persisted since last snapshot, after which a new snapshot is stored.
     * @return the threshold, 0 when snapshots should not be stored
     */
    int snapshotThreshold();

    /**
     * Time without any message, after which the worker is passivated and its in-memory state is released. An idle
     * worker is never passivated while a command is in flight.
     * @return the timeout, empty when workers stay active until the runtime is closed
     */
    Optional<Duration> inactivityTimeout();

    /**
     * Maximum number of commands waiting while another command is in flight. Commands over the limit are rejected.
     * @return the limit, 0 for unbounded queue
     */
    int pendingCommandLimit();

    /**
     * Number of messages a worker processes before it yields its thread to other workers.
     * @return positive number of messages
     */
    int throughput();
}
