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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed arguments of the {@code move} command.
 *
 * <p>Repeatable flags ({@code -c}, {@code -d}, {@code -p}) keep their order. Values may be
 * given as {@code --flag value} or {@code --flag=value}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public final class MoveArguments {

    private final List<String> positional = new ArrayList<>();
    private final List<String> config = new ArrayList<>();
    private final List<String> devices = new ArrayList<>();
    private final List<String> profiles = new ArrayList<>();
    private boolean noProfiles;
    private boolean instanceOnly;
    private boolean stateless;
    private boolean allowInconsistent;
    private boolean quiet;
    private boolean help;
    private String mode;
    private String storage;
    private String target;
    private String targetProject;
    private String project;

    private MoveArguments() {
    }

    public static MoveArguments parse(String[] args) throws UsageException {
        MoveArguments parsed = new MoveArguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            if (arg.startsWith("--") && arg.contains("=")) {
                inlineValue = arg.substring(arg.indexOf('=') + 1);
                arg = arg.substring(0, arg.indexOf('='));
            }

            switch (arg) {
                case "-c":
                case "--config":
                    parsed.config.add(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    break;
                case "-d":
                case "--device":
                    parsed.devices.add(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    break;
                case "-p":
                case "--profile":
                    parsed.profiles.add(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    break;
                case "--no-profiles":
                    parsed.noProfiles = true;
                    break;
                case "--instance-only":
                    parsed.instanceOnly = true;
                    break;
                case "--stateless":
                    parsed.stateless = true;
                    break;
                case "--allow-inconsistent":
                    parsed.allowInconsistent = true;
                    break;
                case "--mode":
                    parsed.mode = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    break;
                case "-s":
                case "--storage":
                    parsed.storage = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    break;
                case "--target":
                    parsed.target = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    break;
                case "--target-project":
                    parsed.targetProject = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    break;
                case "--project":
                    parsed.project = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    break;
                case "-q":
                case "--quiet":
                    parsed.quiet = true;
                    break;
                case "-h":
                case "--help":
                    parsed.help = true;
                    break;
                default:
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new UsageException("Unknown flag: " + arg);
                    }
                    parsed.positional.add(arg);
            }
        }

        if (!parsed.help) {
            parsed.checkArity();
        }
        return parsed;
    }

    private static String value(String[] args, int index, String flag) throws UsageException {
        if (index >= args.length) {
            throw new UsageException("Flag " + flag + " needs a value");
        }
        return args[index];
    }

    // A lone source is only meaningful when a target, pool or project says where to go
    private void checkArity() throws UsageException {
        int min = hasPlacementFlag() ? 1 : 2;
        if (positional.size() < min || positional.size() > 2) {
            throw new UsageException("Invalid number of arguments");
        }
    }

    public boolean hasPlacementFlag() {
        return target != null || targetProject != null || storage != null;
    }

    public String getSource() {
        return positional.get(0);
    }

    /**
     * @return the destination token, or null when only a source was given
     */
    public String getDestination() {
        return positional.size() > 1 ? positional.get(1) : null;
    }

    public List<String> getConfig() {
        return Collections.unmodifiableList(config);
    }

    public List<String> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    public List<String> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }

    public boolean isNoProfiles() { return noProfiles; }
    public boolean isInstanceOnly() { return instanceOnly; }
    public boolean isStateless() { return stateless; }
    public boolean isAllowInconsistent() { return allowInconsistent; }
    public boolean isQuiet() { return quiet; }
    public boolean isHelp() { return help; }
    public String getMode() { return mode; }
    public String getStorage() { return storage; }
    public String getTarget() { return target; }
    public String getTargetProject() { return targetProject; }
    public String getProject() { return project; }
}
