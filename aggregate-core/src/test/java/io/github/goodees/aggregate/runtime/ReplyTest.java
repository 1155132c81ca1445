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

import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ReplyTest {

    @Test(expected = UnsupportedOperationException.class)
    public void client_cannot_complete() {
        new Reply<String>().complete("value");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void client_cannot_complete_exceptionally() {
        new Reply<String>().completeExceptionally(new IllegalStateException());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void client_cannot_cancel() {
        new Reply<String>().cancel(true);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void client_cannot_obtrude() {
        new Reply<String>().obtrudeValue("value");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void client_cannot_complete_async() {
        new Reply<String>().completeAsync(() -> "value");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void client_cannot_complete_async_with_executor() {
        new Reply<String>().completeAsync(() -> "value", ForkJoinPool.commonPool());
    }

    @Test(timeout = 2000)
    public void timeout_fails_dependent_future_only() throws Exception {
        Reply<String> reply = new Reply<>();
        CompletableFuture<String> timed = reply.orTimeout(20, TimeUnit.MILLISECONDS);
        try {
            timed.get();
            fail("Dependent future should time out");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(TimeoutException.class));
        }
        assertFalse(reply.isDone());
        reply.resolve("value");
        assertEquals("value", reply.get());
    }

    @Test(timeout = 2000)
    public void timeout_fallback_is_given_to_dependent_future() throws Exception {
        Reply<String> reply = new Reply<>();
        assertEquals("fallback", reply.completeOnTimeout("fallback", 20, TimeUnit.MILLISECONDS).get());
        assertFalse(reply.isDone());
    }

    @Test
    public void dependent_future_follows_answer_before_timeout() throws Exception {
        Reply<String> reply = new Reply<>();
        CompletableFuture<String> timed = reply.orTimeout(1, TimeUnit.MINUTES);
        reply.resolve("value");
        assertEquals("value", timed.get(1, TimeUnit.SECONDS));
    }

    @Test
    public void runtime_completes_the_reply() throws Exception {
        Reply<String> reply = new Reply<>();
        reply.resolve("value");
        assertEquals("value", reply.get());
    }

    @Test
    public void runtime_fails_the_reply() throws Exception {
        Reply<String> reply = new Reply<>();
        IllegalStateException failure = new IllegalStateException("failed");
        reply.reject(failure);
        assertTrue(reply.isCompletedExceptionally());
        try {
            reply.get();
            fail("Reply should have failed");
        } catch (ExecutionException e) {
            assertEquals(failure, e.getCause());
        }
    }
}
