/*
 * Copyright 2026 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.relocus.client;

import dev.mars.relocus.core.OperationStatus;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RestRemoteOperationTest {

    @ParameterizedTest(name = "status code {0} is {1}")
    @CsvSource({
            "100, PENDING",
            "105, PENDING",
            "101, RUNNING",
            "103, RUNNING",
            "104, RUNNING",
            "106, RUNNING",
            "200, SUCCESS",
            "400, FAILURE",
            "401, CANCELLED",
            "500, FAILURE"
    })
    void statusCodeMapping(int statusCode, OperationStatus expected) {
        assertEquals(expected, RestRemoteOperation.toOperationStatus(statusCode));
    }

    @Test
    void progressKeepsOnlyProgressEntries() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("fs_progress", "rootfs: 42% (12.5MB/s)");
        metadata.put("control", "secret");
        metadata.put("count_progress", 3);
        metadata.put("empty_progress", null);

        Map<String, String> progress = RestRemoteOperation.progressOf(metadata);

        assertEquals(2, progress.size());
        assertEquals("rootfs: 42% (12.5MB/s)", progress.get("fs_progress"));
        assertEquals("3", progress.get("count_progress"));
    }

    @Test
    void progressOfNothing() {
        assertTrue(RestRemoteOperation.progressOf(null).isEmpty());
    }
}
