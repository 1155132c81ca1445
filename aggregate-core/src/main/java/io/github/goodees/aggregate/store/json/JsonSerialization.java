package io.github.goodees.aggregate.store.json;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.aggregate.store.Serialization;
import io.github.goodees.aggregate.store.SerializationException;

import java.io.IOException;
import java.util.Objects;

/**
 * Serialization of a Jackson-mappable type into JSON. All objects are written with the same payload version, and
 * only that version can be read. Subclasses can override {@link #deserialize(int, String)} to upcast older payloads.
 * @param <T> type of serialized objects
 */
public class JsonSerialization<T> implements Serialization<T> {
    private final Class<T> type;
    private final int payloadVersion;
    protected final ObjectMapper mapper;

    public JsonSerialization(Class<T> type, int payloadVersion) {
        this(type, payloadVersion, createMapper());
    }

    public JsonSerialization(Class<T> type, int payloadVersion, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "Type must be specified");
        this.payloadVersion = payloadVersion;
        this.mapper = Objects.requireNonNull(mapper, "Mapper must be specified");
    }

    /**
     * Mapper understanding Optionals and java.time types, writing dates as ISO strings.
     * @return new mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public int payloadVersion(T object) {
        return payloadVersion;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (IOException e) {
            throw new SerializationException("Cannot serialize " + object, e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload) {
        if (payloadVersion != this.payloadVersion) {
            throw new SerializationException("Unsupported payload version " + payloadVersion + " of "
                    + type.getName() + ", expected " + this.payloadVersion, null);
        }
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new SerializationException("Cannot deserialize " + type.getName(), e);
        }
    }
}
