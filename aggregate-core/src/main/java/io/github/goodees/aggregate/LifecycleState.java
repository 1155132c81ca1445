package io.github.goodees.aggregate;

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

/**
 * Control plane state of an aggregate, distinct from its business state.
 */
public enum LifecycleState {
    /**
     * No state yet, only creation commands are accepted.
     */
    UNINITIALIZED,
    /**
     * State is present, update commands are accepted.
     */
    AVAILABLE,
    /**
     * A command is being validated or persisted. Incoming commands wait in the pending queue.
     */
    BUSY;

    /**
     * The accepting state corresponding to presence of aggregate state.
     * @param initialized whether the aggregate has state
     * @return {@link #AVAILABLE} for initialized aggregate, {@link #UNINITIALIZED} otherwise
     */
    public static LifecycleState accepting(boolean initialized) {
        return initialized ? AVAILABLE : UNINITIALIZED;
    }
}
