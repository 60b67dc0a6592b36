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

package org.elasticsoftware.folio.errors;

import jakarta.annotation.Nullable;
import org.elasticsoftware.folio.FolioException;

/**
 * Thrown by business logic to refuse a command. Rejections are terminal: neither the coordinator nor
 * the orchestrators retry them.
 */
public class CommandRejectedException extends FolioException {
    private final ErrorKind kind;

    public CommandRejectedException(ErrorKind kind, @Nullable String domain, @Nullable String aggregateId, String reason) {
        super(domain, aggregateId, reason);
        this.kind = kind;
    }

    public static CommandRejectedException invalidArgument(String reason) {
        return new CommandRejectedException(ErrorKind.INVALID_ARGUMENT, null, null, reason);
    }

    public static CommandRejectedException failedPrecondition(String reason) {
        return new CommandRejectedException(ErrorKind.FAILED_PRECONDITION, null, null, reason);
    }

    @Override
    public ErrorKind getKind() {
        return kind;
    }

    public String getReason() {
        return getMessage();
    }
}
