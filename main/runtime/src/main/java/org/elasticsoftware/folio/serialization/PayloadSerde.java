/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.folio.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.elasticsoftware.folio.aggregate.CommandType;
import org.elasticsoftware.folio.aggregate.DomainEventType;
import org.elasticsoftware.folio.book.Payload;
import org.elasticsoftware.folio.commands.Command;
import org.elasticsoftware.folio.events.DomainEvent;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts typed commands, events and states to and from {@link Payload}s using JSON.
 */
public class PayloadSerde {
    private final ObjectMapper objectMapper;
    private final Map<Class<?>, String> typeNames = new ConcurrentHashMap<>();

    public PayloadSerde(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Payload serialize(DomainEvent event) {
        String typeName = typeNames.computeIfAbsent(event.getClass(),
                type -> DomainEventType.of(event.getClass()).typeName());
        return serialize(typeName, event);
    }

    public Payload serialize(Command command) {
        String typeName = typeNames.computeIfAbsent(command.getClass(),
                type -> CommandType.of(command.getClass()).typeName());
        return serialize(typeName, command);
    }

    public Payload serialize(String typeName, Object value) {
        try {
            return new Payload(typeName, objectMapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new PayloadSerializationException(typeName, "Unable to serialize " + typeName, e);
        }
    }

    public <T> T deserialize(Payload payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload.data(), type);
        } catch (IOException e) {
            throw new PayloadSerializationException(payload.typeName(),
                    "Unable to deserialize " + payload.typeName() + " into " + type.getSimpleName(), e);
        }
    }
}
