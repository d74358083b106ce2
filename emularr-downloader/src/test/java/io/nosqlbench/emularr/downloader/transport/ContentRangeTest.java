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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ContentRangeTest {

    @Test
    void testParseSatisfiedRange() {
        ContentRange range = ContentRange.parse("bytes 100-199/1000");

        assertEquals(new ContentRange(100L, 199L, 1000L), range);
    }

    @Test
    void testParseUnknownTotal() {
        assertEquals(-1L, ContentRange.parse("bytes 0-0/*").totalLength());
    }

    @Test
    void testRejectMalformedValues() {
        assertNull(ContentRange.parse(null));
        assertNull(ContentRange.parse("bytes */1000"));
        assertNull(ContentRange.parse("items 0-1/2"));
        assertNull(ContentRange.parse("bytes a-b/c"));
    }
}
