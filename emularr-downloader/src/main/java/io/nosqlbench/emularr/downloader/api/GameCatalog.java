package io.nosqlbench.emularr.downloader.api;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.UUID;
import java.util.function.Function;

/// Receives finished downloads.
public interface GameCatalog {

    /// Record a downloaded game.
    /// @param request the description of what was downloaded and where it ended up
    /// @return the stored entry
    /// @throws CatalogException if the entry cannot be persisted
    CatalogEntry registerEntry(CatalogEntryRequest request);

    /// @return a catalog that accepts every entry and stores nothing
    static GameCatalog discarding() {
        return request -> CatalogEntry.from(UUID.randomUUID().toString(), request);
    }

    /// Adapt a function into a catalog, handy for collecting entries in tests or callers
    /// that keep their own bookkeeping.
    /// @param registrar the function that stores the request
    /// @return a catalog delegating to the function
    static GameCatalog of(Function<CatalogEntryRequest, CatalogEntry> registrar) {
        return registrar::apply;
    }
}
