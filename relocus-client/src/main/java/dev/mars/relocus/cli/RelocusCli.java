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

import dev.mars.relocus.client.RemotesConfiguration;
import dev.mars.relocus.client.RemotesConfigurationException;
import dev.mars.relocus.client.RestConnectionProvider;
import dev.mars.relocus.config.RelocusConfiguration;
import dev.mars.relocus.connection.ConnectionProvider;
import dev.mars.relocus.core.RelocationOutcome;
import dev.mars.relocus.core.RelocationRequest;
import dev.mars.relocus.core.exceptions.OrphanedSourceAfterMoveException;
import dev.mars.relocus.core.exceptions.RelocationException;
import dev.mars.relocus.endpoint.EndpointResolver;
import dev.mars.relocus.engine.DefaultRelocationEngine;
import dev.mars.relocus.engine.RelocationEngine;
import dev.mars.relocus.supervisor.ConsoleProgressRenderer;

import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Command line front end: {@code relocus move|mv [<remote>:]<source>[/<snapshot>] [[<remote>:]<destination>[/<snapshot>]]}.
 *
 * <p>Exit codes: 0 success, 1 failure with the source intact, 2 usage error,
 * 3 copy succeeded but the source could not be deleted, 130 cancelled.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class RelocusCli {
    private static final Logger logger = Logger.getLogger(RelocusCli.class.getName());

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_ORPHANED = 3;
    public static final int EXIT_CANCELLED = 130;

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final ConnectionProvider connectionProvider;
    private final RelocusConfiguration configuration;
    private final PrintStream out;
    private final PrintStream err;
    private final boolean handleInterrupts;

    public RelocusCli(ConnectionProvider connectionProvider, RelocusConfiguration configuration,
                      PrintStream out, PrintStream err, boolean handleInterrupts) {
        this.connectionProvider = connectionProvider;
        this.configuration = configuration;
        this.out = out;
        this.err = err;
        this.handleInterrupts = handleInterrupts;
    }

    public static void main(String[] args) {
        RelocusConfiguration configuration = new RelocusConfiguration();
        RemotesConfiguration remotes;
        try {
            remotes = RemotesConfiguration.load(configuration.getRemotesFile());
        } catch (RemotesConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(EXIT_FAILURE);
            return;
        }
        RelocusCli cli = new RelocusCli(new RestConnectionProvider(remotes, configuration), configuration,
                System.out, System.err, true);
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(out);
            return args.length == 0 ? EXIT_USAGE : EXIT_SUCCESS;
        }

        String command = args[0];
        if (!command.equals("move") && !command.equals("mv")) {
            err.println("Unknown command: " + command);
            printUsage(err);
            return EXIT_USAGE;
        }

        String[] commandArgs = new String[args.length - 1];
        System.arraycopy(args, 1, commandArgs, 0, commandArgs.length);

        MoveArguments arguments;
        RelocationRequest request;
        try {
            arguments = MoveArguments.parse(commandArgs);
            if (arguments.isHelp()) {
                printUsage(out);
                return EXIT_SUCCESS;
            }
            MoveCommand moveCommand = new MoveCommand(new EndpointResolver(connectionProvider),
                    configuration.getDefaultTransferMode());
            request = moveCommand.toRequest(arguments);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (RelocationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        RelocationEngine engine = new DefaultRelocationEngine(connectionProvider, configuration);
        try {
            return relocate(engine, request, arguments.isQuiet() || configuration.isProgressQuiet());
        } finally {
            engine.shutdown();
        }
    }

    private int relocate(RelocationEngine engine, RelocationRequest request, boolean quiet) {
        ConsoleProgressRenderer renderer = new ConsoleProgressRenderer(out, ConsoleProgressRenderer.TRANSFER_FORMAT, quiet);
        CountDownLatch finished = new CountDownLatch(1);
        Thread interruptHandler = null;
        if (handleInterrupts) {
            interruptHandler = new Thread(() -> {
                if (engine.cancelRelocation(request.getRequestId())) {
                    err.println("Cancelling relocation...");
                    try {
                        finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }, "relocus-interrupt");
            Runtime.getRuntime().addShutdownHook(interruptHandler);
        }

        RelocationOutcome outcome;
        try {
            outcome = engine.relocate(request, renderer);
        } finally {
            finished.countDown();
            if (interruptHandler != null) {
                try {
                    Runtime.getRuntime().removeShutdownHook(interruptHandler);
                } catch (IllegalStateException e) {
                    logger.fine("Shutdown in progress, leaving interrupt handler registered");
                }
            }
        }
        return report(outcome);
    }

    int report(RelocationOutcome outcome) {
        if (outcome.isSuccessful()) {
            return EXIT_SUCCESS;
        }
        if (outcome.isCancelled()) {
            err.println("Relocation cancelled");
            return EXIT_CANCELLED;
        }
        RelocationException error = outcome.getError().orElse(null);
        if (error instanceof OrphanedSourceAfterMoveException) {
            OrphanedSourceAfterMoveException orphaned = (OrphanedSourceAfterMoveException) error;
            err.println("Error: " + error.getMessage());
            err.println("The instance was copied to " + orphaned.getDestination() +
                    " but " + orphaned.getSource() + " still exists and must be deleted by hand");
            return EXIT_ORPHANED;
        }
        err.println("Error: " + (error != null ? error.getMessage() : "Relocation failed"));
        return EXIT_FAILURE;
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: relocus move [<remote>:]<instance>[/<snapshot>] [[<remote>:][<instance>[/<snapshot>]]] [flags]");
        stream.println();
        stream.println("Move instances within or in between servers.");
        stream.println();
        stream.println("Flags:");
        stream.println("  -c, --config <key=value>          Config key/value to apply to the target instance");
        stream.println("  -d, --device <dev,key=value>      New key/value to apply to a specific device");
        stream.println("  -p, --profile <name>              Profile to apply to the target instance");
        stream.println("      --no-profiles                 Unset all profiles on the target instance");
        stream.println("      --instance-only               Move the instance without its snapshots");
        stream.println("      --mode <pull|push|relay>      Transfer mode");
        stream.println("      --stateless                   Copy a stateful instance stateless");
        stream.println("  -s, --storage <pool>              Storage pool name");
        stream.println("      --target <member>             Cluster member name");
        stream.println("      --target-project <project>    Copy to a project different from the source");
        stream.println("      --allow-inconsistent          Ignore copy errors for volatile files");
        stream.println("      --project <project>           Project of the source instance");
        stream.println("  -q, --quiet                       Don't show progress information");
    }
}
