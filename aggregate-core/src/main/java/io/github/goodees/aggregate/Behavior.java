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

import io.github.goodees.aggregate.matching.BehaviorBuilder;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Decision logic of an aggregate. The runtime never decides on its own which events result from a command, nor how
 * an event changes the state. It delegates both to the behavior.
 *
 * <p>Validation is asynchronous. An implementation may query external systems before it decides, but it must not
 * change any state, neither its own nor the state of other systems. The returned stage completes with events to
 * persist, or exceptionally with the reason the command was rejected. The runtime persists the events, and only after
 * persistence succeeds it applies them via {@link #applyCreation(Object)} and {@link #applyUpdate(Object, Object)}.</p>
 *
 * <p>Apply methods must be pure and robust. They are called both for live events and for events replayed during
 * recovery, and an exception thrown from them makes the aggregate irrecoverable.</p>
 *
 * @param <C> type of commands
 * @param <E> type of events
 * @param <S> type of aggregate state
 * @see BehaviorBuilder for building a behavior out of class-keyed handlers
 */
public interface Behavior<C, E, S> {

    /**
     * Whether the command creates the aggregate. Creation commands are only accepted by uninitialized aggregates,
     * all other commands only by initialized ones.
     * @param command the command
     * @return true if the command is a creation command
     */
    boolean isCreationCommand(C command);

    /**
     * Validate a creation command.
     * @param command creation command
     * @return stage completing with the events to persist, or exceptionally with the rejection
     */
    CompletionStage<List<E>> validateCreation(C command);

    /**
     * Validate an update command against current state.
     * @param command update command
     * @param state current state of the aggregate
     * @return stage completing with the events to persist, or exceptionally with the rejection
     */
    CompletionStage<List<E>> validateUpdate(C command, S state);

    /**
     * Whether the event creates the aggregate. Creation events are only applied to uninitialized aggregates, other
     * events only to initialized ones.
     * @param event the event
     * @return true if the event is a creation event
     */
    boolean isCreationEvent(E event);

    /**
     * Create the state out of creation event.
     * @param event creation event
     * @return initial state
     */
    S applyCreation(E event);

    /**
     * Derive next state.
     * @param event update event
     * @param state current state
     * @return next state
     */
    S applyUpdate(E event, S state);
}
