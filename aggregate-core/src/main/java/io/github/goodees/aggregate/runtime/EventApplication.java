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

import io.github.goodees.aggregate.Behavior;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Folds single event onto optional state. A creation event is only applied to absent state, and any other event only
 * to present state. Events not fitting the state are ignored, and the state is returned unchanged.
 *
 * @param <E> type of events
 * @param <S> type of aggregate state
 */
public class EventApplication<E, S> {
    private static final Logger logger = LoggerFactory.getLogger(EventApplication.class);

    private final String aggregateId;
    private final Behavior<?, E, S> behavior;

    public EventApplication(String aggregateId, Behavior<?, E, S> behavior) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.behavior = Objects.requireNonNull(behavior, "Behavior must be specified");
    }

    /**
     * Derive next state.
     * @param current current state
     * @param event event to apply
     * @return next state
     */
    public Optional<S> apply(Optional<S> current, E event) {
        boolean creation = behavior.isCreationEvent(event);
        if (!current.isPresent() && creation) {
            return Optional.of(Objects.requireNonNull(behavior.applyCreation(event),
                "Creation event " + event + " resulted in no state"));
        } else if (current.isPresent() && !creation) {
            return Optional.of(Objects.requireNonNull(behavior.applyUpdate(event, current.get()),
                "Event " + event + " resulted in no state"));
        }
        logger.warn("Ignoring {} event {} for {} aggregate {}", creation ? "creation" : "update", event,
            current.isPresent() ? "initialized" : "uninitialized", aggregateId);
        return current;
    }
}
