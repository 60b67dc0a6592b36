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

package org.elasticsoftware.folio.book;

import jakarta.validation.constraints.NotNull;

import java.util.Arrays;
import java.util.Objects;

/**
 * A type identifier plus the serialized body of a command, event or state. The body is copied on the
 * way in and on the way out, so a payload read from storage cannot be altered by its reader.
 */
public record Payload(@NotNull String typeName, @NotNull byte[] data) {
    public Payload {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(data, "data");
        if (typeName.isBlank()) {
            throw new IllegalArgumentException("typeName must not be blank");
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Payload other)) return false;
        return typeName.equals(other.typeName) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * typeName.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Payload[typeName=" + typeName + ", size=" + data.length + "]";
    }
}
