package io.nosqlbench.emularr.downloader;

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

import java.util.Map;

/// What the caller knows about the game being downloaded.
/// @param name the display name, may be null
/// @param platform the platform label, may be null
/// @param properties free-form extra properties
public record GameMetadata(String name, String platform, Map<String, String> properties) {

    public GameMetadata {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    /// @param name the display name
    /// @param platform the platform label
    /// @return metadata without extra properties
    public static GameMetadata of(String name, String platform) {
        return new GameMetadata(name, platform, Map.of());
    }

    /// @return metadata carrying nothing
    public static GameMetadata empty() {
        return new GameMetadata(null, null, Map.of());
    }

    /// @return true if a non-blank name is present
    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
