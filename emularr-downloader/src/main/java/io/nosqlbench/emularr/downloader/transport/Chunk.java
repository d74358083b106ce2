package io.nosqlbench.emularr.downloader.transport;

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

import okhttp3.Call;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/// One contiguous byte range of a chunked transfer.
///
/// A chunk is always written front to back, so {@link #bytesDownloaded()} is also the length
/// of the finished prefix of the range. A resumed transfer continues at {@link #nextOffset()}.
public final class Chunk {

    private final int index;
    private final long startOffset;
    private final long endOffset;
    private final AtomicLong bytesDownloaded = new AtomicLong();
    private final AtomicReference<Call> activeCall = new AtomicReference<>();
    private volatile boolean cancelled;

    /// @param index the position of this chunk in its plan
    /// @param startOffset the first byte, inclusive
    /// @param endOffset the last byte, inclusive
    public Chunk(int index, long startOffset, long endOffset) {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                "Invalid chunk range " + startOffset + "-" + endOffset);
        }
        this.index = index;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public int index() {
        return index;
    }

    public long startOffset() {
        return startOffset;
    }

    public long endOffset() {
        return endOffset;
    }

    /// @return the number of bytes this chunk covers
    public long length() {
        return endOffset - startOffset + 1;
    }

    public long bytesDownloaded() {
        return bytesDownloaded.get();
    }

    /// @return the file offset of the next byte this chunk still needs
    public long nextOffset() {
        return startOffset + bytesDownloaded.get();
    }

    public boolean isComplete() {
        return bytesDownloaded.get() >= length();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /// Stop this chunk and abort its in-flight call, if any.
    public void cancel() {
        cancelled = true;
        Call call = activeCall.get();
        if (call != null) {
            call.cancel();
        }
    }

    /// Clear the cancelled flag so the chunk can be relaunched by a resumed transfer.
    public void rearm() {
        cancelled = false;
    }

    void recordWritten(long bytes) {
        bytesDownloaded.addAndGet(bytes);
    }

    void attach(Call call) {
        activeCall.set(call);
        if (cancelled) {
            call.cancel();
        }
    }

    void detach(Call call) {
        activeCall.compareAndSet(call, null);
    }

    @Override
    public String toString() {
        return "Chunk[" + index + ": " + startOffset + "-" + endOffset
            + ", downloaded=" + bytesDownloaded.get() + "]";
    }
}
