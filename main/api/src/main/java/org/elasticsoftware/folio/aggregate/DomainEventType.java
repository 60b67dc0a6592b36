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

package org.elasticsoftware.folio.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.elasticsoftware.folio.annotations.DomainEventInfo;
import org.elasticsoftware.folio.events.DomainEvent;

import java.util.Objects;

public record DomainEventType<E extends DomainEvent>(String typeName, @JsonIgnore Class<E> typeClass) {
    public DomainEventType {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(typeClass, "typeClass");
    }

    public static <E extends DomainEvent> DomainEventType<E> of(Class<E> typeClass) {
        DomainEventInfo info = typeClass.getAnnotation(DomainEventInfo.class);
        if (info == null) {
            throw new IllegalArgumentException("DomainEvent class " + typeClass.getName() + " must be annotated with @DomainEventInfo");
        }
        return new DomainEventType<>(info.type(), typeClass);
    }
}
