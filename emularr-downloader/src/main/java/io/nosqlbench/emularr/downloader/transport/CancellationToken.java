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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/// A task-wide stop signal. Cancelling the token also cancels every HTTP call currently
/// registered with it, which closes their sockets and unblocks pending reads.
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Call> calls = ConcurrentHashMap.newKeySet();

    /// @return true once {@link #cancel()} was called
    public boolean isCancelled() {
        return cancelled.get();
    }

    /// Signal every transfer using this token to stop. Idempotent.
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            calls.forEach(Call::cancel);
        }
    }

    /// Track an in-flight call. A call registered after cancellation is cancelled immediately.
    /// @param call the call
    public void register(Call call) {
        calls.add(call);
        if (cancelled.get()) {
            call.cancel();
        }
    }

    /// @param call a call that finished
    public void unregister(Call call) {
        calls.remove(call);
    }
}
