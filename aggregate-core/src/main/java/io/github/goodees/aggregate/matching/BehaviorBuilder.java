package io.github.goodees.aggregate.matching;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Builds a {@link Behavior} out of handlers keyed by command and event classes, in the manner of a type switch.
 * Commands registered via {@code onCreation*} are the creation commands, events registered via
 * {@link #createdBy(Class, Function)} are the creation events. First matching registration wins.
 *
 * <pre>
 * Behavior&lt;AccountCommand, AccountEvent, Account&gt; behavior = BehaviorBuilder.&lt;AccountCommand, AccountEvent, Account&gt;builder()
 *     .onCreationEvent(Open.class, cmd -&gt; Opened.of(cmd.getOwner()))
 *     .onUpdateEvent(Deposit.class, (cmd, account) -&gt; Deposited.of(cmd.getAmount()))
 *     .createdBy(Opened.class, Account::opened)
 *     .updatedBy(Deposited.class, (evt, account) -&gt; account.deposit(evt.getAmount()))
 *     .build();
 * </pre>
 *
 * @param <C> type of commands
 * @param <E> type of events
 * @param <S> type of aggregate state
 */
public class BehaviorBuilder<C, E, S> {
    private final List<Match<? extends C, Function<C, CompletionStage<List<E>>>>> creationHandlers = new ArrayList<>();
    private final List<Match<? extends C, BiFunction<C, S, CompletionStage<List<E>>>>> updateHandlers = new ArrayList<>();
    private final List<Match<? extends E, Function<E, S>>> creationAppliers = new ArrayList<>();
    private final List<Match<? extends E, BiFunction<E, S, S>>> updateAppliers = new ArrayList<>();

    public static <C, E, S> BehaviorBuilder<C, E, S> builder() {
        return new BehaviorBuilder<>();
    }

    /**
     * Default result for command without a handler.
     * @param command unmatched command
     * @return UnsupportedOperationException describing that the command is not supported
     */
    public static Exception defaultUnsupportedCommandHandler(Object command) {
        return new UnsupportedOperationException("Command of type " + command.getClass().getSimpleName()
                + " is not supported");
    }

    /**
     * Helper for returning completion stage that completed exceptionally
     * @param e exception to complete with
     * @param <U> type of response
     * @return CompletableFuture that completed exceptionally.
     */
    public static <U> CompletionStage<U> throwingException(Throwable e) {
        CompletableFuture<U> result = new CompletableFuture<>();
        result.completeExceptionally(e);
        return result;
    }

    /**
     * Register asynchronous validation of a creation command.
     * @param clazz command class
     * @param handler validation
     * @param <T> type of command
     * @return this builder
     */
    public <T extends C> BehaviorBuilder<C, E, S> onCreation(Class<T> clazz,
            Function<T, CompletionStage<List<E>>> handler) {
        Objects.requireNonNull(handler, "Handler must be defined");
        creationHandlers.add(new Match<T, Function<C, CompletionStage<List<E>>>>(clazz,
            (c) -> handler.apply(clazz.cast(c))));
        return this;
    }

    /**
     * Register synchronous validation of a creation command. Exception thrown by the handler rejects the command.
     * @param clazz command class
     * @param handler validation
     * @param <T> type of command
     * @return this builder
     */
    public <T extends C> BehaviorBuilder<C, E, S> onCreationSync(Class<T> clazz, Handler<T, List<E>> handler) {
        return onCreation(clazz, (c) -> invoke(() -> handler.apply(c)));
    }

    /**
     * Register synchronous validation of a creation command resulting in single event.
     * @param clazz command class
     * @param handler validation
     * @param <T> type of command
     * @return this builder
     */
    public <T extends C> BehaviorBuilder<C, E, S> onCreationEvent(Class<T> clazz, Handler<T, E> handler) {
        return onCreation(clazz, (c) -> invoke(() -> Collections.singletonList(handler.apply(c))));
    }

    /**
     * Register asynchronous validation of an update command.
     * @param clazz command class
     * @param handler validation getting the command and current state
     * @param <T> type of command
     * @return this builder
     */
    public <T extends C> BehaviorBuilder<C, E, S> onUpdate(Class<T> clazz,
            BiFunction<T, S, CompletionStage<List<E>>> handler) {
        Objects.requireNonNull(handler, "Handler must be defined");
        updateHandlers.add(new Match<T, BiFunction<C, S, CompletionStage<List<E>>>>(clazz,
            (c, s) -> handler.apply(clazz.cast(c), s)));
        return this;
    }

    /**
     * Register synchronous validation of an update command. Exception thrown by the handler rejects the command.
     * @param clazz command class
     * @param handler validation
     * @param <T> type of command
     * @return this builder
     */
    public <T extends C> BehaviorBuilder<C, E, S> onUpdateSync(Class<T> clazz, UpdateHandler<T, S, List<E>> handler) {
        return onUpdate(clazz, (c, s) -> invoke(() -> handler.apply(c, s)));
    }

    /**
     * Register synchronous validation of an update command resulting in single event.
     * @param clazz command class
     * @param handler validation
     * @param <T> type of command
     * @return this builder
     */
    public <T extends C> BehaviorBuilder<C, E, S> onUpdateEvent(Class<T> clazz, UpdateHandler<T, S, E> handler) {
        return onUpdate(clazz, (c, s) -> invoke(() -> Collections.singletonList(handler.apply(c, s))));
    }

    /**
     * Register a creation event.
     * @param clazz event class
     * @param applier function creating the state
     * @param <T> type of event
     * @return this builder
     */
    public <T extends E> BehaviorBuilder<C, E, S> createdBy(Class<T> clazz, Function<T, S> applier) {
        Objects.requireNonNull(applier, "Applier must be defined");
        creationAppliers.add(new Match<T, Function<E, S>>(clazz, (e) -> applier.apply(clazz.cast(e))));
        return this;
    }

    /**
     * Register an update event.
     * @param clazz event class
     * @param applier function deriving next state
     * @param <T> type of event
     * @return this builder
     */
    public <T extends E> BehaviorBuilder<C, E, S> updatedBy(Class<T> clazz, BiFunction<T, S, S> applier) {
        Objects.requireNonNull(applier, "Applier must be defined");
        updateAppliers.add(new Match<T, BiFunction<E, S, S>>(clazz, (e, s) -> applier.apply(clazz.cast(e), s)));
        return this;
    }

    public Behavior<C, E, S> build() {
        return new BuiltBehavior<>(this);
    }

    private CompletionStage<List<E>> invoke(Callable<List<E>> call) {
        try {
            return CompletableFuture.completedFuture(call.call());
        } catch (Exception e) {
            return throwingException(e);
        }
    }

    private static <F> F find(List<? extends Match<?, F>> matches, Object instance) {
        for (Match<?, F> match : matches) {
            if (match.matches(instance)) {
                return match.callback;
            }
        }
        return null;
    }

    @FunctionalInterface
    public interface Handler<T, U> {
        U apply(T argument) throws Exception;
    }

    @FunctionalInterface
    public interface UpdateHandler<T, S, U> {
        U apply(T argument, S state) throws Exception;
    }

    static class Match<T, F> {
        private final Class<T> clazz;
        private final F callback;

        Match(Class<T> clazz, F callback) {
            this.clazz = Objects.requireNonNull(clazz, "Class must be defined");
            this.callback = callback;
        }

        boolean matches(Object instance) {
            return instance != null && clazz.isInstance(instance);
        }

        @Override
        public String toString() {
            return "Match{" + clazz.getSimpleName() + '}';
        }
    }

    static class BuiltBehavior<C, E, S> implements Behavior<C, E, S> {
        private static final Logger logger = LoggerFactory.getLogger(BehaviorBuilder.class);

        private final List<Match<? extends C, Function<C, CompletionStage<List<E>>>>> creationHandlers;
        private final List<Match<? extends C, BiFunction<C, S, CompletionStage<List<E>>>>> updateHandlers;
        private final List<Match<? extends E, Function<E, S>>> creationAppliers;
        private final List<Match<? extends E, BiFunction<E, S, S>>> updateAppliers;

        BuiltBehavior(BehaviorBuilder<C, E, S> builder) {
            this.creationHandlers = new ArrayList<>(builder.creationHandlers);
            this.updateHandlers = new ArrayList<>(builder.updateHandlers);
            this.creationAppliers = new ArrayList<>(builder.creationAppliers);
            this.updateAppliers = new ArrayList<>(builder.updateAppliers);
        }

        @Override
        public boolean isCreationCommand(C command) {
            return find(creationHandlers, command) != null;
        }

        @Override
        public CompletionStage<List<E>> validateCreation(C command) {
            Function<C, CompletionStage<List<E>>> handler = find(creationHandlers, command);
            if (handler == null) {
                return throwingException(defaultUnsupportedCommandHandler(command));
            }
            return handler.apply(command);
        }

        @Override
        public CompletionStage<List<E>> validateUpdate(C command, S state) {
            BiFunction<C, S, CompletionStage<List<E>>> handler = find(updateHandlers, command);
            if (handler == null) {
                return throwingException(defaultUnsupportedCommandHandler(command));
            }
            return handler.apply(command, state);
        }

        @Override
        public boolean isCreationEvent(E event) {
            return find(creationAppliers, event) != null;
        }

        @Override
        public S applyCreation(E event) {
            Function<E, S> applier = find(creationAppliers, event);
            if (applier == null) {
                throw new IllegalArgumentException("Event " + event + " is not a creation event");
            }
            return applier.apply(event);
        }

        @Override
        public S applyUpdate(E event, S state) {
            BiFunction<E, S, S> applier = find(updateAppliers, event);
            if (applier == null) {
                logger.warn("No applier for event {}, state is left unchanged", event);
                return state;
            }
            return applier.apply(event, state);
        }
    }
}
