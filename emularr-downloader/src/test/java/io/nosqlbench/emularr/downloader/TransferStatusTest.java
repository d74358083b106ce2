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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

public class TransferStatusTest {

    @Test
    void testDownloadingTransitions() {
        assertTrue(TransferStatus.DOWNLOADING.canTransitionTo(TransferStatus.PAUSED));
        assertTrue(TransferStatus.DOWNLOADING.canTransitionTo(TransferStatus.COMPLETED));
        assertTrue(TransferStatus.DOWNLOADING.canTransitionTo(TransferStatus.ERROR));
        assertTrue(TransferStatus.DOWNLOADING.canTransitionTo(TransferStatus.CANCELLED));
        assertFalse(TransferStatus.DOWNLOADING.canTransitionTo(TransferStatus.DOWNLOADING));
    }

    @Test
    void testPausedTransitions() {
        assertTrue(TransferStatus.PAUSED.canTransitionTo(TransferStatus.DOWNLOADING));
        assertTrue(TransferStatus.PAUSED.canTransitionTo(TransferStatus.CANCELLED));
        assertTrue(TransferStatus.PAUSED.canTransitionTo(TransferStatus.ERROR));
        assertFalse(TransferStatus.PAUSED.canTransitionTo(TransferStatus.COMPLETED));
    }

    @Test
    void testErrorCannotRestart() {
        assertFalse(TransferStatus.ERROR.canTransitionTo(TransferStatus.DOWNLOADING));
    }

    @ParameterizedTest
    @EnumSource(value = TransferStatus.class, names = {"COMPLETED", "ERROR", "CANCELLED"})
    void testTerminalStatesHaveNoSuccessors(TransferStatus terminal) {
        assertTrue(terminal.isTerminal());
        assertFalse(terminal.isActive());
        for (TransferStatus next : TransferStatus.values()) {
            assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
        }
    }
}
