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

package dev.mars.relocus.observability;

import dev.mars.relocus.core.RelocationStrategy;
import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the relocation engine.
 *
 * Instruments:
 * - relocus.relocation.active (gauge) - Relocations currently running
 * - relocus.relocation.total (counter) - Relocations started
 * - relocus.relocation.succeeded (counter) - Relocations that completed
 * - relocus.relocation.failed (counter) - Relocations that failed, by error kind
 * - relocus.relocation.cancelled (counter) - Relocations cancelled by the caller
 * - relocus.relocation.orphaned (counter) - Copies whose source could not be deleted
 * - relocus.relocation.duration.seconds (histogram) - Relocation duration distribution
 * - relocus.relay.bytes.total (counter) - Bytes copied by relay transfers
 *
 * Without an OpenTelemetry SDK on the classpath every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class RelocationTelemetryMetrics {

    private static final Logger logger = Logger.getLogger(RelocationTelemetryMetrics.class.getName());
    private static final String METER_NAME = "relocus-core";

    private static RelocationTelemetryMetrics instance;

    private final LongCounter relocationsTotal;
    private final LongCounter relocationsSucceeded;
    private final LongCounter relocationsFailed;
    private final LongCounter relocationsCancelled;
    private final LongCounter relocationsOrphaned;
    private final LongCounter relayBytes;

    private final DoubleHistogram relocationDuration;

    private final AtomicLong activeRelocations = new AtomicLong(0);

    private static final AttributeKey<String> STRATEGY_KEY = AttributeKey.stringKey("strategy");
    private static final AttributeKey<String> TOPOLOGY_KEY = AttributeKey.stringKey("topology");
    private static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");

    private RelocationTelemetryMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        relocationsTotal = meter.counterBuilder("relocus.relocation.total")
                .setDescription("Total number of relocations started")
                .setUnit("1")
                .build();

        relocationsSucceeded = meter.counterBuilder("relocus.relocation.succeeded")
                .setDescription("Number of relocations that completed successfully")
                .setUnit("1")
                .build();

        relocationsFailed = meter.counterBuilder("relocus.relocation.failed")
                .setDescription("Number of failed relocations")
                .setUnit("1")
                .build();

        relocationsCancelled = meter.counterBuilder("relocus.relocation.cancelled")
                .setDescription("Number of cancelled relocations")
                .setUnit("1")
                .build();

        relocationsOrphaned = meter.counterBuilder("relocus.relocation.orphaned")
                .setDescription("Number of copies whose source instance could not be deleted")
                .setUnit("1")
                .build();

        relayBytes = meter.counterBuilder("relocus.relay.bytes.total")
                .setDescription("Total bytes copied between peers by relay transfers")
                .setUnit("By")
                .build();

        relocationDuration = meter.histogramBuilder("relocus.relocation.duration.seconds")
                .setDescription("Relocation duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("relocus.relocation.active")
                .setDescription("Number of relocations currently running")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRelocations.get()));

        logger.info("RelocationTelemetryMetrics initialized");
    }

    public static synchronized RelocationTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new RelocationTelemetryMetrics();
        }
        return instance;
    }

    public void recordRelocationStarted() {
        relocationsTotal.add(1);
        activeRelocations.incrementAndGet();
    }

    public void recordRelocationSucceeded(RelocationStrategy strategy, double durationSeconds) {
        activeRelocations.decrementAndGet();
        Attributes attrs = strategyAttributes(strategy).build();
        relocationsSucceeded.add(1, attrs);
        relocationDuration.record(durationSeconds, attrs);
    }

    /**
     * Record a failed relocation. The strategy is null when the request was rejected before selection.
     */
    public void recordRelocationFailed(RelocationStrategy strategy, RelocationErrorKind kind) {
        activeRelocations.decrementAndGet();
        Attributes attrs = strategyAttributes(strategy)
                .put(ERROR_KIND_KEY, kind != null ? kind.name().toLowerCase() : "unknown")
                .build();
        relocationsFailed.add(1, attrs);
        if (kind == RelocationErrorKind.ORPHANED_SOURCE_AFTER_MOVE) {
            relocationsOrphaned.add(1, attrs);
        }
    }

    public void recordRelocationCancelled(RelocationStrategy strategy) {
        activeRelocations.decrementAndGet();
        relocationsCancelled.add(1, strategyAttributes(strategy).build());
    }

    public void recordRelayBytes(long bytes) {
        if (bytes > 0) {
            relayBytes.add(bytes);
        }
    }

    public long getActiveRelocations() {
        return activeRelocations.get();
    }

    private static AttributesBuilder strategyAttributes(RelocationStrategy strategy) {
        AttributesBuilder builder = Attributes.builder()
                .put(STRATEGY_KEY, strategy != null ? strategy.kind().getLabel() : "none");
        if (strategy instanceof RelocationStrategy.ClientMediatedCopy) {
            builder.put(TOPOLOGY_KEY, ((RelocationStrategy.ClientMediatedCopy) strategy).topology().getWireName());
        }
        return builder;
    }
}
