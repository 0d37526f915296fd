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

package dev.mars.relocus.supervisor;

/**
 * Receives progress text for display. Has no influence on the relocation.
 */
public interface ProgressRenderer {

    void update(String progress);

    /**
     * Finish the display, printing a final message when it is not empty.
     */
    void done(String message);

    static ProgressRenderer noop() {
        return new ProgressRenderer() {
            @Override
            public void update(String progress) {
            }

            @Override
            public void done(String message) {
            }
        };
    }
}
