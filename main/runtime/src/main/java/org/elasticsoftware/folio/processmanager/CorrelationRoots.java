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

package org.elasticsoftware.folio.processmanager;

import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Derives the root of a process manager stream from a correlation id: a name-based (version 5) UUID in
 * the OID namespace, so every node computes the same root without coordination.
 */
public final class CorrelationRoots {
    private static final UUID OID_NAMESPACE = UUID.fromString("6ba7b812-9dad-11d1-80b4-00c04fd430c8");

    private CorrelationRoots() {
    }

    public static UUID rootOf(String correlationId) {
        byte[] namespace = ByteBuffer.allocate(16)
                .putLong(OID_NAMESPACE.getMostSignificantBits())
                .putLong(OID_NAMESPACE.getLeastSignificantBits())
                .array();
        @SuppressWarnings("deprecation")
        byte[] hash = Hashing.sha1().newHasher()
                .putBytes(namespace)
                .putString(correlationId, StandardCharsets.UTF_8)
                .hash()
                .asBytes();
        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);
        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}
