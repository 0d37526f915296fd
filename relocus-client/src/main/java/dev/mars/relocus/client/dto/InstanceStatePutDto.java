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


package dev.mars.relocus.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PUT /1.0/instances/{name}/state}.
 */
public class InstanceStatePutDto {

    @JsonProperty("action")
    private String action;

    @JsonProperty("timeout")
    private int timeout;

    @JsonProperty("force")
    private boolean force;

    public InstanceStatePutDto() {
    }

    public static InstanceStatePutDto forceStop() {
        InstanceStatePutDto dto = new InstanceStatePutDto();
        dto.setAction("stop");
        dto.setTimeout(-1);
        dto.setForce(true);
        return dto;
    }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public int getTimeout() { return timeout; }
    public void setTimeout(int timeout) { this.timeout = timeout; }

    public boolean isForce() { return force; }
    public void setForce(boolean force) { this.force = force; }
}
