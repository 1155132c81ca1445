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

/**
 * Conversion of aggregate state to and from a String payload, used by {@link SnapshotStoreWithSerialization}.
 * <p>Every payload is stored together with the version it was written in. When the shape of the state changes
 * incompatibly, the serialization writes a new version, and keeps reading the older ones it still finds in the
 * store.</p>
 *
 * @param <T> serialized type
 */
public interface Serialization<T> {
    /**
     * @param object state about to be written
     * @return version the payload of the object is written in
     */
    int payloadVersion(T object);

    /**
     * @param object state to write
     * @return the payload
     * @throws SerializationException when the object cannot be written
     */
    String serialize(T object);

    /**
     * Read a payload written in given version.
     *
     * @param payloadVersion version recorded next to the payload
     * @param payload the payload
     * @return the state
     * @throws SerializationException when the version is not supported or the payload is corrupt
     */
    T deserialize(int payloadVersion, String payload);
}
