package de.bsommerfeld.canary.cli;

import de.bsommerfeld.canary.core.error.LifecycleException;

import java.io.IOException;

/** One top-level subcommand. */
interface Command {

    /** @return the process exit code */
    int execute(CommandLine args) throws UsageException, LifecycleException, IOException;
}
