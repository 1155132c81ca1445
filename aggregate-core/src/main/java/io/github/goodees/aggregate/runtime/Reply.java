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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Answer to a command or query submitted to {@link AggregateRuntime}. Only the worker that processed the message
 * resolves it, all mutators inherited from CompletableFuture are disabled for the callers.
 *
 * @param <T> type of the answer
 */
public final class Reply<T> extends CompletableFuture<T> {

    Reply() {
    }

    private static UnsupportedOperationException answeredByAggregate() {
        return new UnsupportedOperationException("Reply is resolved by the aggregate worker only");
    }

    @Override
    public boolean complete(T value) {
        throw answeredByAggregate();
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw answeredByAggregate();
    }

    @Override
    public void obtrudeValue(T value) {
        throw answeredByAggregate();
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw answeredByAggregate();
    }

    @Override
    public CompletableFuture<T> completeAsync(Supplier<? extends T> supplier) {
        throw answeredByAggregate();
    }

    @Override
    public CompletableFuture<T> completeAsync(Supplier<? extends T> supplier, Executor executor) {
        throw answeredByAggregate();
    }

    /**
     * Time out waiting for the answer. The reply itself stays unaffected, the timeout applies to the returned
     * dependent future.
     */
    @Override
    public CompletableFuture<T> orTimeout(long timeout, TimeUnit unit) {
        return copy().orTimeout(timeout, unit);
    }

    /**
     * Fall back to a value when the answer does not arrive in time. The reply itself stays unaffected, the value is
     * given to the returned dependent future.
     */
    @Override
    public CompletableFuture<T> completeOnTimeout(T value, long timeout, TimeUnit unit) {
        return copy().completeOnTimeout(value, timeout, unit);
    }

    /**
     * A submitted command stays in the mailbox or pending queue until processed, so it cannot be withdrawn.
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        throw new UnsupportedOperationException("Submitted messages cannot be withdrawn");
    }

    void resolve(T value) {
        super.complete(value);
    }

    void reject(Throwable cause) {
        super.completeExceptionally(cause);
    }
}
