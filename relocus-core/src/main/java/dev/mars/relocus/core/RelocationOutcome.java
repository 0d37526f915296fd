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

import dev.mars.relocus.core.exceptions.RelocationErrorKind;
import dev.mars.relocus.core.exceptions.RelocationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of one relocation request: its terminal status, the strategy that ran
 * (absent when the request was rejected before selection), and the error if any.
 *
 * <p>A cancelled relocation carries no error: cancellation is a recognized outcome.
 * {@link #isSourceIntact()} is true whenever the source instance still exists afterwards,
 * including the orphaned case where the copy also exists.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public final class RelocationOutcome {

    private final String requestId;
    private final RelocationStatus status;
    private final RelocationStrategy strategy;
    private final RelocationException error;
    private final boolean sourceIntact;
    private final Instant startTime;
    private final Instant endTime;

    private RelocationOutcome(Builder builder) {
        this.requestId = Objects.requireNonNull(builder.requestId, "Request ID cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.strategy = builder.strategy;
        this.error = builder.error;
        this.sourceIntact = builder.sourceIntact;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
    }

    public String getRequestId() { return requestId; }

    public RelocationStatus getStatus() { return status; }

    public Optional<RelocationStrategy> getStrategy() { return Optional.ofNullable(strategy); }

    public Optional<RelocationException> getError() { return Optional.ofNullable(error); }

    public Optional<RelocationErrorKind> getErrorKind() {
        return getError().map(RelocationException::getKind);
    }

    /**
     * @return true when the source instance is known to still exist at its original coordinates
     */
    public boolean isSourceIntact() { return sourceIntact; }

    public Optional<Instant> getStartTime() { return Optional.ofNullable(startTime); }

    public Optional<Instant> getEndTime() { return Optional.ofNullable(endTime); }

    public Optional<Duration> getDuration() {
        if (startTime != null && endTime != null) {
            return Optional.of(Duration.between(startTime, endTime));
        }
        return Optional.empty();
    }

    public boolean isSuccessful() {
        return status == RelocationStatus.SUCCESS;
    }

    public boolean isCancelled() {
        return status == RelocationStatus.CANCELLED;
    }

    public boolean isOrphanedSource() {
        return error != null && error.getKind() == RelocationErrorKind.ORPHANED_SOURCE_AFTER_MOVE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String requestId;
        private RelocationStatus status;
        private RelocationStrategy strategy;
        private RelocationException error;
        private boolean sourceIntact;
        private Instant startTime;
        private Instant endTime;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder status(RelocationStatus status) {
            this.status = status;
            return this;
        }

        public Builder strategy(RelocationStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder error(RelocationException error) {
            this.error = error;
            return this;
        }

        public Builder sourceIntact(boolean sourceIntact) {
            this.sourceIntact = sourceIntact;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public RelocationOutcome build() {
            return new RelocationOutcome(this);
        }
    }

    @Override
    public String toString() {
        return "RelocationOutcome{" +
                "requestId='" + requestId + '\'' +
                ", status=" + status +
                ", strategy=" + (strategy != null ? strategy.kind().getLabel() : "none") +
                (error != null ? ", error=" + error.getKind() + ": " + error.getMessage() : "") +
                '}';
    }
}
