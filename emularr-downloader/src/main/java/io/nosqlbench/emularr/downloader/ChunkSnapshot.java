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

/// A point-in-time view of one chunk.
/// @param index the chunk's position in its plan
/// @param startOffset first byte, inclusive
/// @param endOffset last byte, inclusive
/// @param bytesDownloaded bytes of this chunk written so far
/// @param cancelled whether the chunk was told to stop
public record ChunkSnapshot(int index, long startOffset, long endOffset, long bytesDownloaded, boolean cancelled) {

    /// @return the number of bytes the chunk covers
    public long length() {
        return endOffset - startOffset + 1;
    }

    /// @return true when every byte of the chunk was written
    public boolean complete() {
        return bytesDownloaded >= length();
    }
}
