package de.bsommerfeld.canary.cli;

import com.google.inject.Inject;
import de.bsommerfeld.canary.backup.BackupArtifact;
import de.bsommerfeld.canary.backup.BackupCreator;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.core.util.ByteFormatter;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Set;

/** {@code backup [--database | --full]} */
class BackupCommand implements Command {

    private final BackupCreator creator;
    private final PrintStream out;

    @Inject
    BackupCommand(BackupCreator creator, Console console) {
        this.creator = creator;
        this.out = console.out();
    }

    @Override
    public int execute(CommandLine args) throws UsageException, LifecycleException, IOException {
        args.allowOnly(Set.of("database", "full"));
        if (args.has("database") && args.has("full")) {
            throw new UsageException("Choose either --database or --full");
        }
        BackupArtifact artifact = args.has("full") ? creator.createFullSystemBackup() : creator.createDatabaseBackup();
        out.printf("Created %s (%s)%n", artifact.file(), ByteFormatter.format(artifact.sizeBytes()));
        return LifecycleCli.OK;
    }
}
