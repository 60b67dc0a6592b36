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

import java.util.List;
import java.util.Objects;

public record CommandBook(@NotNull Cover cover, @NotNull List<CommandPage> pages) {
    public CommandBook {
        Objects.requireNonNull(cover, "cover");
        pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
    }

    public static CommandBook of(Cover cover, CommandPage page) {
        return new CommandBook(cover, List.of(page));
    }

    @Nullable
    public CommandPage firstPage() {
        return pages.isEmpty() ? null : pages.get(0);
    }

    public String domain() {
        return cover.domain();
    }

    /**
     * Returns this book with the given correlation id, unless it already carries one.
     */
    public CommandBook withDefaultCorrelationId(@Nullable String correlationId) {
        if (cover.hasCorrelationId() || correlationId == null) {
            return this;
        }
        return new CommandBook(cover.withCorrelationId(correlationId), pages);
    }
}
