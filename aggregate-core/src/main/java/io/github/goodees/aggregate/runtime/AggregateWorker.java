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
import io.github.goodees.aggregate.LifecycleState;
import io.github.goodees.aggregate.matching.TypeSwitch;
import io.github.goodees.aggregate.store.EventLog;
import io.github.goodees.aggregate.store.RecoveryStream;
import io.github.goodees.aggregate.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The lifecycle state machine of single aggregate instance. Owns the lifecycle, the state and the pending command
 * queue, and touches them only while processing its mailbox.
 *
 * <p>The mailbox is processed by at most one thread at time. Whenever a message is added to an idle mailbox, the
 * worker is submitted to the executor, and it keeps processing until the mailbox is empty, or until it processed
 * {@linkplain AggregateConfiguration#throughput() throughput} messages, in which case it resubmits itself.</p>
 *
 * <p>Validation and persistence run outside of the worker. Their completion is posted back into the mailbox, so
 * the state is never accessed from other threads. While a command is in flight the worker is {@code BUSY}, and
 * further commands wait in the pending queue until the worker returns to an accepting state.</p>
 *
 * @param <C> type of commands
 * @param <E> type of events
 * @param <S> type of aggregate state
 */
class AggregateWorker<C, E, S> implements Runnable {

    /**
     * Callbacks into the owner of the worker.
     */
    interface Listener {
        /**
         * The worker will not process any further messages. Messages still in its mailbox are to be taken over with
         * {@link #drainLeftovers()}.
         * @param worker terminated worker
         */
        void terminated(AggregateWorker<?, ?, ?> worker);
    }

    private final String aggregateId;
    private final Behavior<C, E, S> behavior;
    private final EventLog<E> eventLog;
    private final SnapshotStore<S, ?> snapshotStore;
    private final AggregateConfiguration configuration;
    private final Executor executor;
    private final ScheduledExecutorService scheduler;
    private final Listener listener;
    private final Logger logger;

    private final EventApplication<E, S> eventApplication;
    private final SnapshotManager<S> snapshotManager;
    private final Map<LifecycleState, TypeSwitch> dispatch;

    private final Queue<WorkerMessage> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
    private final AtomicBoolean processing = new AtomicBoolean();
    private volatile boolean terminated;
    private volatile Throwable terminationCause;
    private final Queue<WorkerMessage> stranded = new ConcurrentLinkedQueue<>();
    private volatile ScheduledFuture<?> idleCheck;

    // owned by processing thread
    private LifecycleState lifecycle = LifecycleState.UNINITIALIZED;
    private Optional<S> state = Optional.empty();
    private long lastSequenceNr;
    private WorkerMessage.HandleCommand<C, E> inFlight;
    private final Deque<WorkerMessage.HandleCommand<C, E>> pending = new ArrayDeque<>();
    private boolean passivationRequested;
    private long lastActivity = System.nanoTime();

    AggregateWorker(String aggregateId, String aggregateName, Behavior<C, E, S> behavior, EventLog<E> eventLog,
            SnapshotStore<S, ?> snapshotStore, AggregateConfiguration configuration, Executor executor,
            ScheduledExecutorService scheduler, Listener listener) {
        this.aggregateId = aggregateId;
        this.behavior = behavior;
        this.eventLog = eventLog;
        this.snapshotStore = snapshotStore;
        this.configuration = configuration;
        this.executor = executor;
        this.scheduler = scheduler;
        this.listener = listener;
        this.logger = LoggerFactory.getLogger(AggregateWorker.class.getName() + "." + aggregateName);
        this.eventApplication = new EventApplication<>(aggregateId, behavior);
        this.snapshotManager = new SnapshotManager<>(aggregateId, snapshotStore, configuration.snapshotThreshold());
        this.dispatch = createDispatch();
    }

    String getAggregateId() {
        return aggregateId;
    }

    boolean isTerminated() {
        return terminated;
    }

    /**
     * Recover the aggregate, and schedule inactivity checks. Must be called before any other message is told.
     */
    void start() {
        tell(WorkerMessage.Recover.INSTANCE);
        Optional<Duration> timeout = configuration.inactivityTimeout();
        if (timeout.isPresent()) {
            long interval = Math.max(timeout.get().toMillis() / 2, 1);
            idleCheck = scheduler.scheduleWithFixedDelay(() -> tell(WorkerMessage.IdleTimeout.INSTANCE), interval,
                interval, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Add a message to the mailbox, and start processing it if the worker is idle.
     * @param message message to process
     * @return false if the worker was terminated and will never process the message
     */
    boolean tell(WorkerMessage message) {
        mailbox.add(message);
        if (terminated && mailbox.remove(message)) {
            return false;
        }
        int queueSize = enqueuesWhileBusy.getAndIncrement();
        if (queueSize == 0) {
            schedule();
        }
        return true;
    }

    private void schedule() {
        try {
            executor.execute(this);
        } catch (RejectedExecutionException e) {
            logger.error("Cannot schedule processing of {}", aggregateId, e);
        }
    }

    @Override
    public void run() {
        if (!processing.compareAndSet(false, true)) {
            logger.error("Broken runtime concurrency! Worker of {} was run while already processing", aggregateId);
            return;
        }
        int throughput = configuration.throughput();
        for (int processed = 0; processed < throughput; processed++) {
            if (terminated) {
                // the mailbox now belongs to the owner, see drainLeftovers
                processing.set(false);
                return;
            }
            WorkerMessage message = nextMessage();
            if (message == null) {
                return;
            }
            process(message);
        }
        processing.set(false);
        schedule();
    }

    private WorkerMessage nextMessage() {
        while (true) {
            int enqueues = enqueuesWhileBusy.get();
            WorkerMessage message = mailbox.poll();
            if (message != null) {
                return message;
            }
            // a message might have been told between poll and this point. Unless the count of enqueues is still
            // the same, the teller did not schedule us, and we need to poll again.
            processing.set(false);
            if (enqueuesWhileBusy.compareAndSet(enqueues, 0)) {
                return null;
            }
            processing.set(true);
        }
    }

    private void process(WorkerMessage message) {
        if (message.isActivity()) {
            lastActivity = System.nanoTime();
        }
        logger.debug("{} processing {} in state {}", aggregateId, message, lifecycle);
        try {
            dispatch.get(lifecycle).executeMatching(message);
        } catch (RuntimeException e) {
            logger.error("Processing of {} for {} failed in state {}", message, aggregateId, lifecycle, e);
            if (message.hasReply()) {
                message.failReply(e);
            } else if (lifecycle == LifecycleState.BUSY && inFlight != null) {
                // failed while completing the command in flight, the state cannot be trusted anymore
                WorkerMessage.HandleCommand<C, E> command = inFlight;
                inFlight = null;
                command.failReply(e);
                if (recover()) {
                    becomeAccepting();
                }
            }
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Map<LifecycleState, TypeSwitch> createDispatch() {
        TypeSwitch common = TypeSwitch.builder()
                .on(WorkerMessage.Recover.class, m -> recover())
                .on(WorkerMessage.IdleTimeout.class, m -> idleTimeout())
                .on(WorkerMessage.Stop.class, m -> stop())
                .otherwise(m -> logger.warn("Dropping unexpected message {} for {} in state {}", m, aggregateId,
                    lifecycle))
                .build();

        Map<LifecycleState, TypeSwitch> result = new EnumMap<>(LifecycleState.class);
        result.put(LifecycleState.UNINITIALIZED, TypeSwitch.builder()
                .on(WorkerMessage.HandleCommand.class, m -> uninitializedCommand(m))
                .on(WorkerMessage.GetState.class, m -> replyState(m))
                .build().orElse(common));
        result.put(LifecycleState.AVAILABLE, TypeSwitch.builder()
                .on(WorkerMessage.HandleCommand.class, m -> availableCommand(m))
                .on(WorkerMessage.GetState.class, m -> replyState(m))
                .build().orElse(common));
        result.put(LifecycleState.BUSY, TypeSwitch.builder()
                .on(WorkerMessage.HandleCommand.class, m -> stash(m))
                .on(WorkerMessage.GetState.class, m -> replyState(m))
                .on(WorkerMessage.ValidationSucceeded.class, m -> validationSucceeded(m))
                .on(WorkerMessage.ValidationFailed.class, m -> validationFailed(m))
                .on(WorkerMessage.EventsPersisted.class, m -> eventsPersisted(m))
                .on(WorkerMessage.PersistenceFailed.class, m -> persistenceFailed(m))
                .build().orElse(common));
        return result;
    }

    private void become(LifecycleState next) {
        if (lifecycle != next) {
            logger.debug("{} becomes {}", aggregateId, next);
            lifecycle = next;
        }
    }

    private boolean recover() {
        snapshotManager.reset();
        Recovery<E, S> recovery = new Recovery<>(eventApplication, snapshotManager);
        try {
            RecoveryStream.of(aggregateId, eventLog, snapshotStore).replay(recovery);
        } catch (RuntimeException e) {
            logger.error("Recovery of {} failed", aggregateId, e);
            terminate(e);
            return false;
        }
        state = recovery.getState();
        lastSequenceNr = recovery.getLastSequenceNr();
        become(recovery.getLifecycle());
        logger.debug("{} recovered at sequence number {}, {} events since snapshot", aggregateId, lastSequenceNr,
            snapshotManager.eventsSinceSnapshot());
        return true;
    }

    private void uninitializedCommand(WorkerMessage.HandleCommand<C, E> message) {
        C command = message.command;
        if (behavior.isCreationCommand(command)) {
            startValidation(message, () -> behavior.validateCreation(command));
        } else {
            logger.warn("Rejecting {}, aggregate {} is not initialized", command, aggregateId);
            message.failReply(AggregateException.notInitialized(aggregateId));
        }
    }

    private void availableCommand(WorkerMessage.HandleCommand<C, E> message) {
        C command = message.command;
        if (behavior.isCreationCommand(command)) {
            logger.warn("Rejecting {}, aggregate {} is already initialized", command, aggregateId);
            message.failReply(AggregateException.alreadyInitialized(aggregateId, command));
        } else {
            S current = state.get();
            startValidation(message, () -> behavior.validateUpdate(command, current));
        }
    }

    private void replyState(WorkerMessage.GetState<S> message) {
        if (state.isPresent()) {
            message.reply.resolve(state.get());
        } else {
            message.failReply(AggregateException.notInitialized(aggregateId));
        }
    }

    private void stash(WorkerMessage.HandleCommand<C, E> message) {
        int limit = configuration.pendingCommandLimit();
        if (limit > 0 && pending.size() >= limit) {
            logger.warn("Rejecting {}, {} commands of {} already pending", message.command, limit, aggregateId);
            message.failReply(AggregateException.pendingLimitExceeded(aggregateId, limit));
            return;
        }
        pending.add(message);
        logger.debug("{} queued {}, {} commands pending", aggregateId, message.command, pending.size());
    }

    private void startValidation(WorkerMessage.HandleCommand<C, E> message,
            Supplier<CompletionStage<List<E>>> validation) {
        inFlight = message;
        become(LifecycleState.BUSY);
        CompletionStage<List<E>> result;
        try {
            result = validation.get();
            if (result == null) {
                result = failed(new IllegalStateException("Validation of " + message.command
                        + " returned no result"));
            }
        } catch (RuntimeException e) {
            result = failed(e);
        }
        result.whenComplete((events, failure) -> {
            if (failure != null) {
                tell(new WorkerMessage.ValidationFailed(message, unwrapCompletionException(failure)));
            } else {
                tell(new WorkerMessage.ValidationSucceeded<>(message, events));
            }
        });
    }

    private void validationSucceeded(WorkerMessage.ValidationSucceeded<C, E> message) {
        if (!isInFlight(message.source)) {
            return;
        }
        List<E> events = message.events == null ? Collections.emptyList() : new ArrayList<>(message.events);
        if (events.isEmpty()) {
            logger.debug("{} of {} resulted in no events", message.source.command, aggregateId);
            completeInFlight(events);
            return;
        }
        CompletionStage<Long> appended;
        try {
            appended = eventLog.appendAll(aggregateId, events);
        } catch (RuntimeException e) {
            appended = failed(e);
        }
        appended.whenComplete((sequenceNr, failure) -> {
            if (failure != null) {
                tell(new WorkerMessage.PersistenceFailed(message.source, unwrapCompletionException(failure)));
            } else {
                tell(new WorkerMessage.EventsPersisted<>(message.source, events, sequenceNr));
            }
        });
    }

    private void validationFailed(WorkerMessage.ValidationFailed message) {
        if (!isInFlight(message.source)) {
            return;
        }
        logger.error("Validation of {} for {} failed", message.source.command, aggregateId, message.cause);
        WorkerMessage.HandleCommand<C, E> command = inFlight;
        inFlight = null;
        command.failReply(message.cause);
        becomeAccepting();
    }

    private void eventsPersisted(WorkerMessage.EventsPersisted<C, E> message) {
        if (!isInFlight(message.source)) {
            return;
        }
        long sequenceNr = message.lastSequenceNr - message.events.size();
        for (E event : message.events) {
            state = eventApplication.apply(state, event);
            sequenceNr++;
            snapshotManager.eventPersisted(sequenceNr, state);
        }
        lastSequenceNr = message.lastSequenceNr;
        logger.debug("{} applied {} events up to sequence number {}", aggregateId, message.events.size(),
            lastSequenceNr);
        completeInFlight(message.events);
    }

    private void persistenceFailed(WorkerMessage.PersistenceFailed message) {
        if (!isInFlight(message.source)) {
            return;
        }
        logger.error("Persisting events of {} for {} failed, recovering from the log", message.source.command,
            aggregateId, message.cause);
        WorkerMessage.HandleCommand<C, E> command = inFlight;
        inFlight = null;
        command.failReply(message.cause);
        if (recover()) {
            becomeAccepting();
        }
    }

    private boolean isInFlight(WorkerMessage.HandleCommand<?, ?> source) {
        if (source != inFlight) {
            logger.warn("Dropping completion of {} for {}, command in flight is {}", source.command, aggregateId,
                inFlight == null ? null : inFlight.command);
            return false;
        }
        return true;
    }

    private void completeInFlight(List<E> events) {
        WorkerMessage.HandleCommand<C, E> command = inFlight;
        inFlight = null;
        command.reply.resolve(new CommandResult<>(aggregateId, events, lastSequenceNr));
        becomeAccepting();
    }

    /**
     * Leave busy state and replay pending commands in their order until one of them makes the worker busy again.
     */
    private void becomeAccepting() {
        inFlight = null;
        become(LifecycleState.accepting(state.isPresent()));
        while (lifecycle != LifecycleState.BUSY && !terminated && !pending.isEmpty()) {
            process(pending.poll());
        }
        if (passivationRequested && lifecycle != LifecycleState.BUSY) {
            passivationRequested = false;
            if (isQuiescent()) {
                passivate();
            }
        }
    }

    private void idleTimeout() {
        Optional<Duration> timeout = configuration.inactivityTimeout();
        if (!timeout.isPresent() || System.nanoTime() - lastActivity < timeout.get().toNanos()) {
            return;
        }
        if (lifecycle == LifecycleState.BUSY) {
            logger.debug("{} is idle, passivation deferred until {} completes", aggregateId, inFlight.command);
            passivationRequested = true;
        } else if (isQuiescent()) {
            passivate();
        }
    }

    private boolean isQuiescent() {
        return pending.isEmpty() && mailbox.isEmpty();
    }

    private void passivate() {
        logger.info("Passivating {} after {} of inactivity", aggregateId, configuration.inactivityTimeout().orElse(
            null));
        terminate(null);
    }

    private void stop() {
        logger.info("Stopping {} in state {}", aggregateId, lifecycle);
        terminate(AggregateException.terminated(aggregateId));
    }

    /**
     * Stop processing messages. Commands the worker holds are failed with the cause, or kept for the successor
     * when the worker is passivated.
     * @param cause failure of commands the worker holds, null for passivation
     */
    private void terminate(Throwable cause) {
        if (cause != null) {
            if (inFlight != null) {
                inFlight.failReply(cause);
            }
            while (!pending.isEmpty()) {
                pending.poll().failReply(cause);
            }
        } else {
            if (inFlight != null) {
                stranded.add(inFlight);
            }
            stranded.addAll(pending);
            pending.clear();
        }
        inFlight = null;
        this.terminationCause = cause;
        terminated = true;
        ScheduledFuture<?> check = idleCheck;
        if (check != null) {
            check.cancel(false);
        }
        listener.terminated(this);
    }

    /**
     * Take the messages with replies a terminated worker did not process. Called by the owner of the worker while
     * no message can be delivered to it.
     * @return unanswered messages in the order they were told
     */
    List<WorkerMessage> drainLeftovers() {
        if (!terminated) {
            throw new IllegalStateException("Worker of " + aggregateId + " is still running");
        }
        List<WorkerMessage> leftovers = new ArrayList<>(stranded);
        stranded.clear();
        WorkerMessage message;
        while ((message = mailbox.poll()) != null) {
            if (message.hasReply()) {
                leftovers.add(message);
            }
        }
        return leftovers;
    }

    /**
     * Why the worker terminated.
     * @return the failure for unanswered messages, or null if the worker was passivated and they should be
     *         delivered to its successor
     */
    Throwable getTerminationCause() {
        return terminationCause;
    }

    private static <T> CompletionStage<T> failed(Throwable t) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeExceptionally(t);
        return result;
    }

    static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    @Override
    public String toString() {
        return "AggregateWorker{" + aggregateId + '}';
    }
}
