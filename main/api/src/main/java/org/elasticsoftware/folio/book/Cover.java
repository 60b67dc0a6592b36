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

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * Addresses a single stream: the domain plus the root of the aggregate. The correlation id links the
 * books of a multi-aggregate workflow and is what process managers are keyed on.
 */
public record Cover(@NotNull String domain, @NotNull UUID root, @Nullable String correlationId) {
    public Cover {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(root, "root");
        if (domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        if (correlationId != null && correlationId.isBlank()) {
            correlationId = null;
        }
    }

    public Cover(String domain, UUID root) {
        this(domain, root, null);
    }

    public boolean hasCorrelationId() {
        return correlationId != null;
    }

    public Cover withCorrelationId(@Nullable String correlationId) {
        return new Cover(domain, root, correlationId);
    }

    /**
     * Identity of the stream, ignoring the correlation id.
     */
    public String streamKey() {
        return domain + "/" + root;
    }
}
