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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the relocation request model and its location references.
 */
class RelocationRequestTest {

    @Nested
    @DisplayName("Request defaults")
    class Defaults {

        @Test
        void destinationDefaultsToSource() {
            LocationRef source = LocationRef.of("local", "web1");
            RelocationRequest request = RelocationRequest.builder().source(source).build();

            assertEquals(source, request.getDestination());
            assertEquals(TransferMode.PULL, request.getTransferMode());
            assertTrue(request.isStateful());
            assertNotNull(request.getRequestId());
            assertFalse(request.hasOverrides());
            assertFalse(request.hasTargets());
        }

        @Test
        void sourceIsRequired() {
            assertThrows(NullPointerException.class, () -> RelocationRequest.builder().build());
        }

        @Test
        void emptyTargetsAreTreatedAsAbsent() {
            RelocationRequest request = RelocationRequest.builder()
                    .source(LocationRef.of("local", "web1"))
                    .targetMember("")
                    .targetPool("")
                    .targetProject("")
                    .build();

            assertNull(request.getTargetMember());
            assertNull(request.getTargetPool());
            assertNull(request.getTargetProject());
            assertFalse(request.hasTargets());
        }

        @Test
        void requestIdsAreUnique() {
            LocationRef source = LocationRef.of("local", "web1");
            assertNotEquals(RelocationRequest.builder().source(source).build().getRequestId(),
                    RelocationRequest.builder().source(source).build().getRequestId());
        }
    }

    @Nested
    @DisplayName("Override queries")
    class Overrides {

        @Test
        void noProfilesCountsAsProfileOverride() {
            RelocationRequest request = RelocationRequest.builder()
                    .source(LocationRef.of("local", "web1"))
                    .noProfiles(true)
                    .build();

            assertTrue(request.hasProfileOverride());
            assertTrue(request.hasOverrides());
            assertFalse(request.hasConfigOverrides());
        }

        @Test
        void deviceOverridesAccumulatePerDevice() {
            RelocationRequest request = RelocationRequest.builder()
                    .source(LocationRef.of("local", "web1"))
                    .deviceOverride("eth0", "network", "br1")
                    .deviceOverride("eth0", "hwaddr", "00:16:3e:00:00:01")
                    .deviceOverride("root", "size", "20GiB")
                    .build();

            assertTrue(request.hasDeviceOverrides());
            assertEquals(Map.of("network", "br1", "hwaddr", "00:16:3e:00:00:01"),
                    request.getDeviceOverrides().get("eth0"));
            assertEquals(2, request.getDeviceOverrides().getDeviceNames().size());
        }

        @Test
        void toBuilderPreservesEverything() {
            RelocationRequest original = RelocationRequest.builder()
                    .requestId("req-1")
                    .source(LocationRef.of("a", "db1"))
                    .destination(LocationRef.of("b", "db2"))
                    .transferMode(TransferMode.RELAY)
                    .targetPool("fast")
                    .stateless(true)
                    .config("limits.cpu", "4")
                    .deviceOverride("root", "size", "10GiB")
                    .profile("default")
                    .build();

            RelocationRequest copy = original.toBuilder().build();

            assertEquals("req-1", copy.getRequestId());
            assertEquals(original.getDestination(), copy.getDestination());
            assertEquals(TransferMode.RELAY, copy.getTransferMode());
            assertEquals("fast", copy.getTargetPool());
            assertFalse(copy.isStateful());
            assertEquals(original.getConfigOverrides(), copy.getConfigOverrides());
            assertEquals(original.getDeviceOverrides(), copy.getDeviceOverrides());
            assertEquals(List.of("default"), copy.getProfiles());
        }

        @Test
        void overrideMapsAreImmutable() {
            RelocationRequest request = RelocationRequest.builder()
                    .source(LocationRef.of("local", "web1"))
                    .config("limits.cpu", "2")
                    .build();

            assertThrows(UnsupportedOperationException.class,
                    () -> request.getConfigOverrides().put("limits.memory", "1GiB"));
            assertThrows(UnsupportedOperationException.class, () -> request.getProfiles().add("x"));
        }
    }

    @Nested
    @DisplayName("Project changes")
    class ProjectChanges {

        @Test
        void destinationInAnotherProjectIsAProjectChange() {
            RelocationRequest request = RelocationRequest.builder()
                    .source(LocationRef.of("local", "default", "web1"))
                    .destination(LocationRef.of("local", "prod", "web1"))
                    .build();

            assertEquals("prod", request.getProjectChange());
            assertTrue(request.changesProject());
            assertTrue(request.hasTargets());
        }

        @Test
        void targetProjectWinsOverDestinationProject() {
            RelocationRequest request = RelocationRequest.builder()
                    .source(LocationRef.of("local", "default", "web1"))
                    .destination(LocationRef.of("local", "prod", "web1"))
                    .targetProject("staging")
                    .build();

            assertEquals("staging", request.getProjectChange());
        }

        @Test
        void sameOrUnsetProjectIsNoChange() {
            RelocationRequest same = RelocationRequest.builder()
                    .source(LocationRef.of("local", "default", "web1"))
                    .destination(LocationRef.of("local", "default", "web2"))
                    .build();
            RelocationRequest unset = RelocationRequest.builder()
                    .source(LocationRef.of("local", "default", "web1"))
                    .destination(LocationRef.of("local", "web2"))
                    .build();

            assertNull(same.getProjectChange());
            assertFalse(same.hasTargets());
            assertFalse(unset.changesProject());
        }
    }

    @Nested
    @DisplayName("Location references")
    class Locations {

        @Test
        void sameConnectionComparesRemoteOnly() {
            LocationRef a = LocationRef.of("local", "p1", "web1");
            LocationRef b = LocationRef.of("local", "p2", "web2");
            LocationRef c = LocationRef.of("remote", "p1", "web1");

            assertTrue(a.isSameConnection(b));
            assertFalse(a.isSameConnection(c));
            assertFalse(a.isSameConnection(null));
        }

        @Test
        void resourceNameIncludesSnapshot() {
            LocationRef snapshot = LocationRef.snapshot("local", null, "web1", "snap0");

            assertTrue(snapshot.isSnapshot());
            assertEquals("web1/snap0", snapshot.getResourceName());
            assertEquals("local:web1/snap0", snapshot.toString());
        }

        @Test
        void nullInstanceNameBecomesEmpty() {
            LocationRef ref = LocationRef.of("remote", null);

            assertEquals("", ref.getInstanceName());
            assertFalse(ref.hasInstanceName());
            assertEquals(LocationRef.of("remote", "web1"), ref.withInstanceName("web1"));
        }
    }

    @Test
    void transferModeParsing() {
        assertEquals(TransferMode.PULL, TransferMode.fromString(null));
        assertEquals(TransferMode.PULL, TransferMode.fromString(""));
        assertEquals(TransferMode.RELAY, TransferMode.fromString(" Relay "));
        assertEquals(TransferMode.PUSH, TransferMode.fromString("push"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TransferMode.fromString("teleport"));
        assertTrue(e.getMessage().contains("One of pull, push or relay"));
    }
}
