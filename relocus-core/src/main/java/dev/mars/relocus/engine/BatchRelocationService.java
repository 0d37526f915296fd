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

package dev.mars.relocus.engine;

import dev.mars.relocus.core.RelocationOutcome;
import dev.mars.relocus.core.RelocationRequest;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs independent relocations concurrently on a bounded Vert.x worker pool.
 *
 * <p>Each request is a full, blocking relocation on its own worker thread; requests share
 * nothing but the engine's connections. The returned future completes once every request
 * has an outcome, in request order. A failing relocation does not fail the future.</p>
 */
public class BatchRelocationService implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(BatchRelocationService.class.getName());

    private final RelocationEngine engine;
    private final WorkerExecutor workerExecutor;

    public BatchRelocationService(Vertx vertx, RelocationEngine engine, int maxConcurrent) {
        Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("Max concurrent relocations must be positive: " + maxConcurrent);
        }
        this.workerExecutor = vertx.createSharedWorkerExecutor("relocus-batch", maxConcurrent);
    }

    public Future<List<RelocationOutcome>> relocateAll(List<RelocationRequest> requests) {
        if (requests.isEmpty()) {
            return Future.succeededFuture(List.of());
        }
        logger.info("Starting batch of " + requests.size() + " relocation(s)");

        List<Future<RelocationOutcome>> futures = new ArrayList<>();
        for (RelocationRequest request : requests) {
            futures.add(workerExecutor.executeBlocking(() -> engine.relocate(request), false));
        }

        return Future.all(futures).map(composite -> {
            List<RelocationOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(composite.resultAt(i));
            }
            long succeeded = outcomes.stream().filter(RelocationOutcome::isSuccessful).count();
            logger.info("Batch finished: " + succeeded + "/" + outcomes.size() + " relocation(s) succeeded");
            return outcomes;
        });
    }

    /**
     * Cancel every relocation of a batch that is still running.
     *
     * @return the number of relocations that were asked to stop
     */
    public int cancelAll(List<RelocationRequest> requests) {
        int cancelled = 0;
        for (RelocationRequest request : requests) {
            if (engine.cancelRelocation(request.getRequestId())) {
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public void close() {
        workerExecutor.close();
    }
}
