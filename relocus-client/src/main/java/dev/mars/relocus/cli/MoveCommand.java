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


package dev.mars.relocus.cli;

import dev.mars.relocus.core.LocationRef;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.TransferMode;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.endpoint.EndpointResolver;
import dev.mars.relocus.override.OverrideParser;

/**
 * Turns parsed {@code move} arguments into a {@link RelocationRequest}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class MoveCommand {

    private final EndpointResolver endpointResolver;
    private final TransferMode defaultMode;

    public MoveCommand(EndpointResolver endpointResolver, TransferMode defaultMode) {
        this.endpointResolver = endpointResolver;
        this.defaultMode = defaultMode;
    }

    public RelocationRequest toRequest(MoveArguments arguments) throws RelocationException, UsageException {
        TransferMode mode = defaultMode;
        if (arguments.getMode() != null) {
            try {
                mode = TransferMode.fromString(arguments.getMode());
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }

        LocationRef source = endpointResolver.resolveSource(arguments.getSource(), arguments.getProject());
        RelocationRequest.Builder builder = RelocationRequest.builder()
                .source(source)
                .transferMode(mode)
                .targetMember(arguments.getTarget())
                .targetPool(arguments.getStorage())
                .targetProject(arguments.getTargetProject())
                .instanceOnly(arguments.isInstanceOnly())
                .stateless(arguments.isStateless())
                .allowInconsistent(arguments.isAllowInconsistent())
                .noProfiles(arguments.isNoProfiles())
                .configOverrides(OverrideParser.parseConfig(arguments.getConfig()))
                .deviceOverrides(OverrideParser.parseDevices(arguments.getDevices()))
                .profiles(arguments.getProfiles());

        if (arguments.getDestination() != null) {
            builder.destination(endpointResolver.resolveDestination(arguments.getDestination(), arguments.getProject()));
        }
        return builder.build();
    }
}
