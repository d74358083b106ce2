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

import java.util.EnumSet;
import java.util.Set;

/// The lifecycle states of a download task.
public enum TransferStatus {
    DOWNLOADING,
    PAUSED,
    COMPLETED,
    ERROR,
    CANCELLED;

    /// @return true for states a task never leaves
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == CANCELLED;
    }

    /// @return true for states in which the task still holds resources or can continue
    public boolean isActive() {
        return this == DOWNLOADING || this == PAUSED;
    }

    /// @param next the requested state
    /// @return true if a task in this state may move to {@code next}
    public boolean canTransitionTo(TransferStatus next) {
        return successors().contains(next);
    }

    private Set<TransferStatus> successors() {
        switch (this) {
            case DOWNLOADING:
                return EnumSet.of(PAUSED, COMPLETED, ERROR, CANCELLED);
            case PAUSED:
                // a resume that finds the server changed fails from here
                return EnumSet.of(DOWNLOADING, CANCELLED, ERROR);
            default:
                return EnumSet.noneOf(TransferStatus.class);
        }
    }
}
