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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Dispatches an object to the first case whose class (and optional guard) accepts it. Serves for message handling
 * where a visitor would need a method per message type. Lookup is linear in the number of cases.
 *
 * <pre>
 * TypeSwitch handler = TypeSwitch.builder()
 *     .on(Deposit.class, d -&gt; d.getAmount() &gt; 0, this::deposit)
 *     .on(Withdraw.class, this::withdraw)
 *     .otherwise(m -&gt; logger.warn("Unexpected {}", m))
 *     .build();
 * </pre>
 */
public final class TypeSwitch {

    private final List<Case<?>> cases;
    private final Consumer<Object> fallback;

    private TypeSwitch(List<Case<?>> cases, Consumer<Object> fallback) {
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
        this.fallback = fallback;
    }

    /**
     * Pass the message to the first accepting case, or to the fallback.
     * @param message message to dispatch, null is never accepted by a case
     * @return false if neither a case nor a fallback handled the message
     */
    public boolean executeMatching(Object message) {
        for (Case<?> c : cases) {
            if (c.tryAccept(message)) {
                return true;
            }
        }
        if (fallback != null && message != null) {
            fallback.accept(message);
            return true;
        }
        return false;
    }

    /**
     * Switch consulting cases of this switch first, and cases of the other one afterwards. A fallback of this switch
     * takes everything this switch doesn't match, so the other switch is only useful when there is none.
     * @param other switch for messages this one doesn't match
     * @return combined switch
     */
    public TypeSwitch orElse(TypeSwitch other) {
        if (fallback != null) {
            return this;
        }
        List<Case<?>> combined = new ArrayList<>(cases);
        combined.addAll(other.cases);
        return new TypeSwitch(combined, other.fallback);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Case<?>> cases = new ArrayList<>();
        private Consumer<Object> fallback;

        private Builder() {
        }

        public <T> Builder on(Class<T> type, Consumer<T> handler) {
            return on(type, null, handler);
        }

        public <T> Builder on(Class<T> type, Predicate<T> guard, Consumer<T> handler) {
            cases.add(new Case<>(type, guard, handler));
            return this;
        }

        /**
         * Handler for messages no case accepts. Consulted after all cases, regardless of the order of registration.
         * @param handler the fallback
         * @return this builder
         */
        public Builder otherwise(Consumer<Object> handler) {
            this.fallback = Objects.requireNonNull(handler, "Fallback cannot be null");
            return this;
        }

        public TypeSwitch build() {
            return new TypeSwitch(cases, fallback);
        }
    }

    private static final class Case<T> {
        private final Class<T> type;
        private final Predicate<T> guard;
        private final Consumer<T> handler;

        Case(Class<T> type, Predicate<T> guard, Consumer<T> handler) {
            this.type = Objects.requireNonNull(type, "Case type cannot be null");
            this.guard = guard;
            this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        }

        boolean tryAccept(Object message) {
            if (!type.isInstance(message)) {
                return false;
            }
            T typed = type.cast(message);
            if (guard != null && !guard.test(typed)) {
                return false;
            }
            handler.accept(typed);
            return true;
        }
    }
}
