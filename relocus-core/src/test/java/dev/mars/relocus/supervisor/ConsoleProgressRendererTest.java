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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleProgressRendererTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void rewritesLineAndPadsShorterUpdates() {
        ConsoleProgressRenderer renderer = new ConsoleProgressRenderer(out, ConsoleProgressRenderer.TRANSFER_FORMAT, false);

        renderer.update("rootfs: 100MB");
        renderer.update("fs: 1GB");

        assertThat(output()).isEqualTo(
                "\rTransferring instance: rootfs: 100MB" +
                "\rTransferring instance: fs: 1GB      ");
    }

    @Test
    void doneClearsLineAndPrintsMessageOnce() {
        ConsoleProgressRenderer renderer = new ConsoleProgressRenderer(out, "%s", false);
        renderer.update("12345");

        renderer.done("Moved");
        renderer.done("Moved again");
        renderer.update("late");

        assertThat(output()).isEqualTo("\r12345\r     \rMoved" + System.lineSeparator());
    }

    @Test
    void quietRendererPrintsNothing() {
        ConsoleProgressRenderer renderer = new ConsoleProgressRenderer(out, "%s", true);

        renderer.update("rootfs: 100MB");
        renderer.done("Moved");

        assertThat(output()).isEmpty();
    }

    @Test
    void emptyUpdatesAreSkipped() {
        ConsoleProgressRenderer renderer = new ConsoleProgressRenderer(out, null, false);

        renderer.update("");
        renderer.update(null);
        renderer.done("");

        assertThat(output()).isEmpty();
    }
}
