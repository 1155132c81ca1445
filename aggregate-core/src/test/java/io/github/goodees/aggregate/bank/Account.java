package io.github.goodees.aggregate.bank;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * State of the bank account.
 */
public final class Account {
    private final String owner;
    private final long balance;

    @JsonCreator
    public Account(@JsonProperty("owner") String owner, @JsonProperty("balance") long balance) {
        this.owner = owner;
        this.balance = balance;
    }

    static Account opened(Opened event) {
        return new Account(event.getOwner(), event.getInitialDeposit());
    }

    Account deposit(long amount) {
        return new Account(owner, balance + amount);
    }

    Account withdraw(long amount) {
        return new Account(owner, balance - amount);
    }

    public String getOwner() {
        return owner;
    }

    public long getBalance() {
        return balance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Account account = (Account) o;
        return balance == account.balance && Objects.equals(owner, account.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, balance);
    }

    @Override
    public String toString() {
        return "Account{owner=" + owner + ", balance=" + balance + '}';
    }
}
