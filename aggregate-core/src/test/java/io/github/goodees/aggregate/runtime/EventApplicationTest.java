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

import io.github.goodees.aggregate.bank.Account;
import io.github.goodees.aggregate.bank.AccountEvent;
import io.github.goodees.aggregate.bank.Accounts;
import io.github.goodees.aggregate.bank.Deposited;
import io.github.goodees.aggregate.bank.Opened;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class EventApplicationTest {
    private final EventApplication<AccountEvent, Account> application = new EventApplication<>("account",
            Accounts.behavior());

    @Test
    public void creation_event_creates_state() {
        assertEquals(Optional.of(new Account("alice", 3)),
            application.apply(Optional.empty(), Opened.of("alice", 3)));
    }

    @Test
    public void update_event_updates_state() {
        assertEquals(Optional.of(new Account("alice", 5)),
            application.apply(Optional.of(new Account("alice", 3)), Deposited.of(2)));
    }

    @Test
    public void update_event_before_creation_is_ignored() {
        assertFalse(application.apply(Optional.empty(), Deposited.of(2)).isPresent());
    }

    @Test
    public void repeated_creation_event_is_ignored() {
        Optional<Account> state = Optional.of(new Account("alice", 3));
        assertEquals(state, application.apply(state, Opened.of("mallory", 100)));
    }
}
