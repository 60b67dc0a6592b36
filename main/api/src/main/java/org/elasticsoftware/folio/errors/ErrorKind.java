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

public enum ErrorKind {
    /**
     * Malformed or unrecognized command or payload. Never retried.
     */
    INVALID_ARGUMENT,
    /**
     * Sequence conflict or business-rule violation. Conflicts are retried with fresh state, rule violations are terminal.
     */
    FAILED_PRECONDITION,
    /**
     * A stream that was required to exist does not.
     */
    NOT_FOUND,
    INTERNAL
}
