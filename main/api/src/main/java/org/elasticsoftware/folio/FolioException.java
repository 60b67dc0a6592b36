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

package org.elasticsoftware.folio;

import jakarta.annotation.Nullable;
import org.elasticsoftware.folio.errors.ErrorKind;

public abstract class FolioException extends RuntimeException {
    private final String domain;
    private final String aggregateId;

    public FolioException(@Nullable String domain, @Nullable String aggregateId, String message) {
        super(message);
        this.domain = domain;
        this.aggregateId = aggregateId;
    }

    public FolioException(@Nullable String domain, @Nullable String aggregateId, String message, Throwable cause) {
        super(message, cause);
        this.domain = domain;
        this.aggregateId = aggregateId;
    }

    public String getDomain() {
        return domain;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * The stable category of this failure. Callers should branch on this, never on the message text.
     */
    public abstract ErrorKind getKind();
}
