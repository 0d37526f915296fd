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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for OperationStatus transition validation.
 * Covers every (source, target) pair of the operation lifecycle.
 */
class OperationStatusTransitionTest {

    // --- Valid transition map ---

    private static EnumSet<OperationStatus> validTargets(OperationStatus from) {
        return switch (from) {
            case PENDING -> EnumSet.of(OperationStatus.RUNNING, OperationStatus.FAILURE, OperationStatus.CANCELLED);
            case RUNNING -> EnumSet.of(OperationStatus.SUCCESS, OperationStatus.FAILURE, OperationStatus.CANCELLED);
            case SUCCESS, FAILURE, CANCELLED -> EnumSet.noneOf(OperationStatus.class);
        };
    }

    static Stream<Arguments> allOperationStatusPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (OperationStatus from : OperationStatus.values()) {
            Set<OperationStatus> valid = validTargets(from);
            for (OperationStatus to : OperationStatus.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    static Stream<OperationStatus> allOperationStatuses() {
        return Arrays.stream(OperationStatus.values());
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allOperationStatusPairs")
    void canTransitionTo_coversAllPairs(OperationStatus from, OperationStatus to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @MethodSource("allOperationStatuses")
    void getValidTransitions_matchesCanTransitionTo(OperationStatus from) {
        Set<OperationStatus> fromMethod = EnumSet.noneOf(OperationStatus.class);
        fromMethod.addAll(Arrays.asList(from.getValidTransitions()));

        Set<OperationStatus> fromCanTransition = EnumSet.noneOf(OperationStatus.class);
        for (OperationStatus to : OperationStatus.values()) {
            if (from.canTransitionTo(to)) {
                fromCanTransition.add(to);
            }
        }

        assertEquals(fromCanTransition, fromMethod,
                () -> String.format("getValidTransitions() and canTransitionTo() disagree for %s", from));
    }

    @ParameterizedTest(name = "{0} → {0} self-transition should be invalid")
    @MethodSource("allOperationStatuses")
    void selfTransition_isNeverValid(OperationStatus status) {
        assertFalse(status.canTransitionTo(status));
    }

    @Test
    void terminalStates_haveNoTransitions() {
        for (OperationStatus status : OperationStatus.values()) {
            if (status.isTerminal()) {
                assertEquals(0, status.getValidTransitions().length,
                        () -> String.format("Terminal state %s should have no transitions", status));
                assertFalse(status.isCancellable());
            }
        }
    }

    @Test
    void pendingCannotSkipStraightToSuccess() {
        assertFalse(OperationStatus.PENDING.canTransitionTo(OperationStatus.SUCCESS));
    }

    @Test
    void onlySuccessIsSuccessful() {
        for (OperationStatus status : OperationStatus.values()) {
            assertEquals(status == OperationStatus.SUCCESS, status.isSuccessful(), status::name);
        }
    }

    @Test
    void relocationStatusFromOperation_rejectsNonTerminal() {
        assertEquals(RelocationStatus.SUCCESS, RelocationStatus.fromOperation(OperationStatus.SUCCESS));
        assertEquals(RelocationStatus.FAILURE, RelocationStatus.fromOperation(OperationStatus.FAILURE));
        assertEquals(RelocationStatus.CANCELLED, RelocationStatus.fromOperation(OperationStatus.CANCELLED));
        assertThrows(IllegalArgumentException.class, () -> RelocationStatus.fromOperation(OperationStatus.RUNNING));
        assertThrows(IllegalArgumentException.class, () -> RelocationStatus.fromOperation(OperationStatus.PENDING));
    }
}
