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

import io.github.goodees.aggregate.AggregateException;
import io.github.goodees.aggregate.Behavior;
import io.github.goodees.aggregate.CommandResult;
import io.github.goodees.aggregate.store.EventLog;
import io.github.goodees.aggregate.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Facade to speaking with aggregates of single type. It starts a worker for every aggregate that receives a message,
 * which recovers the aggregate state from {@link SnapshotStore} and {@link EventLog} before it processes any command.
 * <p>The runtime guarantees, that for given aggregate id, there is only one worker in the memory, and that it will
 * validate single command at time. Commands are processed in the order they were submitted.</p>
 * <p>Subclasses provide the collaborators by implementing the abstract accessors. They are called whenever a new
 * worker starts, so they should return shared instances.</p>
 *
 * @param <C> type of commands
 * @param <E> type of events
 * @param <S> type of aggregate state
 */
public abstract class AggregateRuntime<C, E, S> implements AutoCloseable {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final ConcurrentMap<String, AggregateWorker<C, E, S>> workers = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private final AggregateWorker.Listener listener = this::replaceTerminated;

    /**
     * Decision logic of the aggregates.
     * @return the behavior
     */
    protected abstract Behavior<C, E, S> getBehavior();

    /**
     * Event log of this runtime. Events are appended into it and recovery replays them from it.
     * @return event log of this runtime
     */
    protected abstract EventLog<E> getEventLog();

    /**
     * The SnapshotStore of this runtime. Snapshots are stored every
     * {@linkplain AggregateConfiguration#snapshotThreshold() threshold} events.
     * @return snapshot store of this runtime
     */
    protected abstract SnapshotStore<S, ?> getSnapshotStore();

    /**
     * The thread pool workers run on.
     * @return the executor service instance
     */
    protected abstract ExecutorService getExecutorService();

    /**
     * Thread pool for inactivity checks. Should be different from executor service.
     * @return scheduled executor service instance
     */
    protected abstract ScheduledExecutorService getScheduler();

    /**
     * Name of the aggregate type, used for logger names of the workers.
     * @return the name
     */
    protected String getAggregateName() {
        return getClass().getSimpleName();
    }

    protected AggregateConfiguration getConfiguration() {
        return SimpleAggregateConfiguration.defaults();
    }

    /**
     * Submit a command to an aggregate. This is the entry point for changing aggregates.
     * <p>The future completes with the events the command resulted in after they were persisted and applied, or
     * exceptionally with the reason the command was rejected. The clients should not call any mutation methods of
     * the CompletableFuture, such as {@linkplain CompletableFuture#complete(Object)}, they throw
     * UnsupportedOperationException.</p>
     * @param aggregateId the identity of the aggregate
     * @param command the command
     * @return CompletableFuture of the result
     */
    public CompletableFuture<CommandResult<E>> execute(String aggregateId, C command) {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        Objects.requireNonNull(command, "Command must be specified");
        WorkerMessage.HandleCommand<C, E> message = new WorkerMessage.HandleCommand<>(command);
        deliver(aggregateId, message);
        return message.reply;
    }

    /**
     * Query current state of an aggregate. While a command is in flight, the state before the command is returned.
     * @param aggregateId the identity of the aggregate
     * @return CompletableFuture of the state, completing exceptionally with {@link AggregateException} when the
     *         aggregate was not created yet
     */
    public CompletableFuture<S> getState(String aggregateId) {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        WorkerMessage.GetState<S> message = new WorkerMessage.GetState<>();
        deliver(aggregateId, message);
        return message.reply;
    }

    /**
     * Ids of aggregates that currently have a worker in the memory.
     * @return snapshot of active ids
     */
    public Set<String> activeAggregates() {
        return Collections.unmodifiableSet(new HashSet<>(workers.keySet()));
    }

    /**
     * Stop all workers. Commands not answered yet, and commands submitted afterwards fail with
     * {@link AggregateException}.
     */
    @Override
    public void close() {
        closed = true;
        logger.info("Closing runtime with {} active aggregates", workers.size());
        for (AggregateWorker<C, E, S> worker : workers.values()) {
            worker.tell(WorkerMessage.Stop.INSTANCE);
        }
    }

    /*
     * Delivery and replacement of terminated workers both happen in the lock of the map entry. Leftovers of a
     * passivated worker therefore reach its successor before any message delivered later. Replies are failed only
     * after the lock is released, as their callbacks may deliver further messages.
     */
    void deliver(String aggregateId, WorkerMessage message) {
        List<Runnable> failures = new ArrayList<>();
        AggregateWorker<C, E, S> target = workers.compute(aggregateId, (id, current) -> {
            if (closed) {
                failures.add(() -> message.failReply(AggregateException.terminated(id)));
                return current;
            }
            AggregateWorker<C, E, S> worker = current;
            while (true) {
                if (worker != null && worker.isTerminated()) {
                    worker = successor(id, worker, failures);
                }
                if (worker == null) {
                    worker = startWorker(id);
                }
                if (worker.tell(message)) {
                    return worker;
                }
            }
        });
        if (target != null && closed) {
            target.tell(WorkerMessage.Stop.INSTANCE);
        }
        failures.forEach(Runnable::run);
    }

    private void replaceTerminated(AggregateWorker<?, ?, ?> terminated) {
        String aggregateId = terminated.getAggregateId();
        List<Runnable> failures = new ArrayList<>();
        workers.computeIfPresent(aggregateId, (id, current) -> current == terminated
                ? successor(id, current, failures) : current);
        failures.forEach(Runnable::run);
        logger.debug("Worker of {} terminated", aggregateId);
    }

    /**
     * Drain a terminated worker. Leftovers of a passivated worker are told to a fresh worker, failing of the others
     * is added to failures.
     * @return the fresh worker, or null when nothing was redelivered
     */
    private AggregateWorker<C, E, S> successor(String aggregateId, AggregateWorker<C, E, S> terminated,
            List<Runnable> failures) {
        List<WorkerMessage> leftovers = terminated.drainLeftovers();
        if (leftovers.isEmpty()) {
            return null;
        }
        Throwable cause = terminated.getTerminationCause();
        if (cause != null || closed) {
            Throwable failure = cause != null ? cause : AggregateException.terminated(aggregateId);
            for (WorkerMessage leftover : leftovers) {
                failures.add(() -> leftover.failReply(failure));
            }
            return null;
        }
        logger.debug("Redelivering {} messages of passivated {}", leftovers.size(), aggregateId);
        AggregateWorker<C, E, S> next = startWorker(aggregateId);
        for (WorkerMessage leftover : leftovers) {
            next.tell(leftover);
        }
        return next;
    }

    private AggregateWorker<C, E, S> startWorker(String aggregateId) {
        AggregateWorker<C, E, S> worker = new AggregateWorker<>(aggregateId, getAggregateName(), getBehavior(),
                getEventLog(), getSnapshotStore(), getConfiguration(), getExecutorService(), getScheduler(), listener);
        worker.start();
        logger.debug("Started worker for {}", aggregateId);
        return worker;
    }
}
