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

package dev.mars.relocus.connection;

import java.io.Closeable;
import java.io.IOException;

/**
 * One bidirectional byte channel of a migration (for example the control or filesystem
 * stream), opened by the client against a migration endpoint.
 */
public interface MigrationChannel extends Closeable {

    String getName();

    /**
     * Read up to {@code buffer.length} bytes.
     *
     * @return the number of bytes read, or -1 once the peer has closed its side
     */
    int read(byte[] buffer) throws IOException;

    void write(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Signal end of stream to the peer while still allowing reads.
     */
    void closeOutput() throws IOException;
}
