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

import io.github.goodees.aggregate.CommandResult;

import java.util.List;

/**
 * Messages in the mailbox of an {@link AggregateWorker}. Commands and queries come from the runtime, completions of
 * validation and persistence are sent by the worker to itself.
 */
abstract class WorkerMessage {

    /**
     * Fail the reply this message carries, if any.
     * @param cause the failure
     */
    void failReply(Throwable cause) {
    }

    boolean hasReply() {
        return false;
    }

    /**
     * Whether processing the message means the aggregate is in use.
     * @return false for housekeeping messages
     */
    boolean isActivity() {
        return true;
    }

    static final class Recover extends WorkerMessage {
        static final Recover INSTANCE = new Recover();

        @Override
        boolean isActivity() {
            return false;
        }

        @Override
        public String toString() {
            return "Recover";
        }
    }

    static final class HandleCommand<C, E> extends WorkerMessage {
        final C command;
        final Reply<CommandResult<E>> reply = new Reply<>();

        HandleCommand(C command) {
            this.command = command;
        }

        @Override
        void failReply(Throwable cause) {
            reply.reject(cause);
        }

        @Override
        boolean hasReply() {
            return true;
        }

        @Override
        public String toString() {
            return "HandleCommand{" + command + '}';
        }
    }

    static final class GetState<S> extends WorkerMessage {
        final Reply<S> reply = new Reply<>();

        @Override
        void failReply(Throwable cause) {
            reply.reject(cause);
        }

        @Override
        boolean hasReply() {
            return true;
        }

        @Override
        public String toString() {
            return "GetState";
        }
    }

    static final class ValidationSucceeded<C, E> extends WorkerMessage {
        final HandleCommand<C, E> source;
        final List<E> events;

        ValidationSucceeded(HandleCommand<C, E> source, List<E> events) {
            this.source = source;
            this.events = events;
        }

        @Override
        public String toString() {
            return "ValidationSucceeded{" + source.command + " -> " + events + '}';
        }
    }

    static final class ValidationFailed extends WorkerMessage {
        final HandleCommand<?, ?> source;
        final Throwable cause;

        ValidationFailed(HandleCommand<?, ?> source, Throwable cause) {
            this.source = source;
            this.cause = cause;
        }

        @Override
        public String toString() {
            return "ValidationFailed{" + source.command + ", cause=" + cause + '}';
        }
    }

    static final class EventsPersisted<C, E> extends WorkerMessage {
        final HandleCommand<C, E> source;
        final List<E> events;
        final long lastSequenceNr;

        EventsPersisted(HandleCommand<C, E> source, List<E> events, long lastSequenceNr) {
            this.source = source;
            this.events = events;
            this.lastSequenceNr = lastSequenceNr;
        }

        @Override
        public String toString() {
            return "EventsPersisted{" + source.command + " -> " + events + " #" + lastSequenceNr + '}';
        }
    }

    static final class PersistenceFailed extends WorkerMessage {
        final HandleCommand<?, ?> source;
        final Throwable cause;

        PersistenceFailed(HandleCommand<?, ?> source, Throwable cause) {
            this.source = source;
            this.cause = cause;
        }

        @Override
        public String toString() {
            return "PersistenceFailed{" + source.command + ", cause=" + cause + '}';
        }
    }

    static final class IdleTimeout extends WorkerMessage {
        static final IdleTimeout INSTANCE = new IdleTimeout();

        @Override
        boolean isActivity() {
            return false;
        }

        @Override
        public String toString() {
            return "IdleTimeout";
        }
    }

    static final class Stop extends WorkerMessage {
        static final Stop INSTANCE = new Stop();

        @Override
        public String toString() {
            return "Stop";
        }
    }
}
