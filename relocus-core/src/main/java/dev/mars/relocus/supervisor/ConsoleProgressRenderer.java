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

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renders progress on a single, rewritten terminal line.
 */
public class ConsoleProgressRenderer implements ProgressRenderer {

    public static final String TRANSFER_FORMAT = "Transferring instance: %s";

    private final PrintStream out;
    private final String format;
    private final boolean quiet;
    private int lastLength;
    private boolean finished;

    public ConsoleProgressRenderer(PrintStream out, String format, boolean quiet) {
        this.out = Objects.requireNonNull(out, "Output cannot be null");
        this.format = format != null ? format : "%s";
        this.quiet = quiet;
    }

    @Override
    public synchronized void update(String progress) {
        if (quiet || finished || progress == null || progress.isEmpty()) {
            return;
        }
        String line = String.format(format, progress);
        out.print("\r" + pad(line));
        out.flush();
        lastLength = line.length();
    }

    @Override
    public synchronized void done(String message) {
        if (finished) {
            return;
        }
        finished = true;
        if (quiet) {
            return;
        }
        if (lastLength > 0) {
            out.print("\r" + " ".repeat(lastLength) + "\r");
        }
        if (message != null && !message.isEmpty()) {
            out.println(message);
        }
        out.flush();
    }

    private String pad(String line) {
        return line.length() < lastLength ? line + " ".repeat(lastLength - line.length()) : line;
    }
}
