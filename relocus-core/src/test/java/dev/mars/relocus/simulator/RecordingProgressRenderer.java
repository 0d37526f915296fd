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

package dev.mars.relocus.simulator;

import dev.mars.relocus.supervisor.ProgressRenderer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Progress renderer that keeps everything it is given.
 */
public class RecordingProgressRenderer implements ProgressRenderer {

    private final List<String> updates = new CopyOnWriteArrayList<>();
    private final List<String> doneMessages = new CopyOnWriteArrayList<>();

    @Override
    public void update(String progress) {
        updates.add(progress);
    }

    @Override
    public void done(String message) {
        doneMessages.add(message);
    }

    public List<String> getUpdates() {
        return Collections.unmodifiableList(new ArrayList<>(updates));
    }

    public int getDoneCount() {
        return doneMessages.size();
    }
}
