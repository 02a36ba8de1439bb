package com.health.checker.cli;

import com.health.checker.api.CheckerEngine;
import com.health.checker.core.model.Cadence;
import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RegisteredChecker;
import com.health.checker.lock.LockAcquisitionException;
import com.health.checker.registry.CheckerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Command line entry point for running checkers by hand.
 *
 * <pre>
 * run &lt;name&gt;      run one checker and record the result
 * run --failing    re-run every checker currently FAILING
 * preview          evaluate every enabled checker without recording anything
 * </pre>
 *
 * <p>The exit code reflects whether the command itself worked, not the health of the checked
 * system: a failing checker still exits with 0.</p>
 */
public class CheckerCli {
    private static final Logger log = LoggerFactory.getLogger(CheckerCli.class);

    static final int OK = 0;
    static final int USAGE_ERROR = 1;

    private static final List<Cadence> PREVIEW_ORDER =
            List.of(Cadence.DAILY, Cadence.HOURLY, Cadence.EVERY_TEN_MINUTES);

    private final CheckerEngine engine;
    private final PrintStream out;
    private final PrintStream err;

    public CheckerCli(CheckerEngine engine, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        CheckerRegistry registry = CheckerRegistry.fromServiceLoader(CheckerCli.class.getClassLoader());
        int exitCode;
        try (CheckerEngine engine = CheckerEngine.builder().registry(registry).build()) {
            exitCode = new CheckerCli(engine, System.out, System.err).execute(args);
        }
        System.exit(exitCode);
    }

    public int execute(String... args) {
        if (args.length == 0) {
            return usage("missing command");
        }
        return switch (args[0]) {
            case "run" -> args.length == 2 ? run(args[1]) : usage("run expects a checker name or --failing");
            case "preview" -> args.length == 1 ? preview() : usage("preview takes no arguments");
            default -> usage("unknown command '" + args[0] + "'");
        };
    }

    private int run(String target) {
        if ("--failing".equals(target)) {
            return runFailing();
        }
        if (!engine.getRegistry().contains(target)) {
            err.println("No checker named '" + target + "' is registered.");
            return USAGE_ERROR;
        }
        out.println("Running " + target + ".");
        try {
            report(engine.run(target));
            return OK;
        } catch (LockAcquisitionException e) {
            err.println(e.getMessage());
            return USAGE_ERROR;
        }
    }

    private int runFailing() {
        try {
            int count = 0;
            for (Checker checker : engine.getStore().findCheckersByStatus(CheckerStatus.FAILING)) {
                if (!engine.getRegistry().contains(checker.getName())) {
                    err.println("Skipping " + checker.getName() + ": no longer registered.");
                    continue;
                }
                out.println("Running " + checker.getName() + ".");
                report(engine.run(checker.getName()));
                count++;
            }
            out.println("Re-ran " + count + " failing checker(s).");
            return OK;
        } catch (LockAcquisitionException e) {
            err.println(e.getMessage());
            return USAGE_ERROR;
        }
    }

    private int preview() {
        for (Cadence cadence : PREVIEW_ORDER) {
            for (RegisteredChecker checker : engine.getRegistry().forCadence(cadence)) {
                if (engine.getConfig().isDisabled(checker.name())) {
                    continue;
                }
                boolean ignored = engine.findChecker(checker.name())
                        .map(Checker::isIgnored)
                        .orElse(false);
                if (ignored) {
                    out.println("SKIPPED " + checker.name());
                    continue;
                }
                CheckerRun run = engine.preview(checker.name());
                out.println(label(run) + " " + checker.name());
            }
        }
        return OK;
    }

    private void report(CheckerRun run) {
        out.println("Checker run " + run.id() + " completed.");
        out.println("Checker run " + run.id() + " status: " + run.status());
    }

    private static String label(CheckerRun run) {
        return switch (run.status()) {
            case SUCCEEDED -> "SUCCESS";
            case FAILED -> "FAILURE";
            case ERRORED -> "ERROR";
            case IN_PROGRESS -> throw new IllegalStateException("Preview returned an unfinished run");
        };
    }

    private int usage(String problem) {
        log.debug("cli.usage_error problem={}", problem);
        err.println("Error: " + problem);
        err.println("Usage: checker run <name> | run --failing | preview");
        return USAGE_ERROR;
    }
}
