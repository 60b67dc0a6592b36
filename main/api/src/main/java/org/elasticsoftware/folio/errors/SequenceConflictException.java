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

import org.elasticsoftware.folio.FolioException;

public class SequenceConflictException extends FolioException {
    private final long expectedSequence;
    private final long actualSequence;

    public SequenceConflictException(String domain, String aggregateId, long expectedSequence, long actualSequence) {
        super(domain, aggregateId, "Sequence conflict on " + domain + "/" + aggregateId
                + ": command expects " + expectedSequence + ", aggregate at " + actualSequence);
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    public long getExpectedSequence() {
        return expectedSequence;
    }

    public long getActualSequence() {
        return actualSequence;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.FAILED_PRECONDITION;
    }

    /**
     * A conflict only means the sender read stale state, re-reading and resubmitting can succeed.
     */
    public boolean isRetryable() {
        return true;
    }
}
