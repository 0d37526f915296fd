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

package dev.mars.relocus.core;

import java.util.Objects;

/**
 * The execution strategy chosen for one relocation request.
 *
 * <p>Strategies are ordered from cheapest to most general: a rename is metadata only,
 * a server-side move keeps the data on one server, and a client-mediated copy works
 * between any two reachable servers at the cost of an explicit delete.</p>
 */
public sealed interface RelocationStrategy
        permits RelocationStrategy.Rename, RelocationStrategy.ServerSideMove, RelocationStrategy.ClientMediatedCopy {

    StrategyKind kind();

    /**
     * Rename the instance (or snapshot) in place on its server.
     */
    record Rename() implements RelocationStrategy {
        @Override
        public StrategyKind kind() {
            return StrategyKind.RENAME;
        }
    }

    /**
     * Single migration operation submitted to the source server.
     */
    record ServerSideMove() implements RelocationStrategy {
        @Override
        public StrategyKind kind() {
            return StrategyKind.SERVER_SIDE_MOVE;
        }
    }

    /**
     * Copy to the destination over the given topology, then delete the source.
     */
    record ClientMediatedCopy(TransferMode topology) implements RelocationStrategy {
        public ClientMediatedCopy {
            Objects.requireNonNull(topology, "Topology cannot be null");
        }

        @Override
        public StrategyKind kind() {
            return StrategyKind.CLIENT_MEDIATED_COPY;
        }
    }

    static RelocationStrategy rename() {
        return new Rename();
    }

    static RelocationStrategy serverSideMove() {
        return new ServerSideMove();
    }

    static RelocationStrategy copy(TransferMode topology) {
        return new ClientMediatedCopy(topology);
    }
}
