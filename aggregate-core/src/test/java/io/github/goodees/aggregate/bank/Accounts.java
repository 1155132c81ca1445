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

import io.github.goodees.aggregate.Behavior;
import io.github.goodees.aggregate.matching.BehaviorBuilder;

/**
 * Bank account used as example aggregate in tests.
 */
public final class Accounts {
    private Accounts() {
    }

    public static Behavior<AccountCommand, AccountEvent, Account> behavior() {
        return BehaviorBuilder.<AccountCommand, AccountEvent, Account>builder()
                .onCreationEvent(Open.class, cmd -> {
                    if (cmd.getInitialDeposit() < 0) {
                        throw new IllegalArgumentException("Initial deposit cannot be negative");
                    }
                    return Opened.of(cmd.getOwner(), cmd.getInitialDeposit());
                })
                .onUpdateEvent(Deposit.class, (cmd, account) -> Deposited.of(cmd.getAmount()))
                .onUpdateEvent(Withdraw.class, (cmd, account) -> {
                    if (account.getBalance() < cmd.getAmount()) {
                        throw new InsufficientFundsException(account.getBalance(), cmd.getAmount());
                    }
                    return Withdrawn.of(cmd.getAmount());
                })
                .createdBy(Opened.class, Account::opened)
                .updatedBy(Deposited.class, (evt, account) -> account.deposit(evt.getAmount()))
                .updatedBy(Withdrawn.class, (evt, account) -> account.withdraw(evt.getAmount()))
                .build();
    }
}
