package io.github.goodees.aggregate.store;

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

import io.github.goodees.aggregate.LifecycleState;
import org.junit.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.Assert.assertEquals;

public class SnapshotTest {

    @Test
    public void lifecycle_is_derived_from_state() {
        assertEquals(LifecycleState.AVAILABLE, Snapshot.of("id", 1, Optional.of("state")).getLifecycle());
        assertEquals(LifecycleState.UNINITIALIZED, Snapshot.of("id", 0, Optional.empty()).getLifecycle());
    }

    @Test(expected = IllegalArgumentException.class)
    public void busy_snapshot_is_rejected() {
        new Snapshot<>("id", 1, LifecycleState.BUSY, Optional.of("state"), Instant.now());
    }

    @Test(expected = IllegalArgumentException.class)
    public void available_snapshot_without_state_is_rejected() {
        new Snapshot<>("id", 1, LifecycleState.AVAILABLE, Optional.empty(), Instant.now());
    }
}
