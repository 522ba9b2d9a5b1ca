package de.bsommerfeld.canary.cli;

import com.google.inject.Inject;
import de.bsommerfeld.canary.backup.BackupArtifact;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.error.ConfirmationDeclinedException;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.core.util.ByteFormatter;
import de.bsommerfeld.canary.restore.ConfirmationPrompt;
import de.bsommerfeld.canary.restore.RestoreCoordinator;
import de.bsommerfeld.canary.restore.RestoreOperation;
import de.bsommerfeld.canary.restore.RestoreType;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** {@code restore [--file <path> [--type auto|database|full_system] | --list [dir] | --interactive | --history [limit]]} */
class RestoreCommand implements Command {

    private static final int INTERACTIVE_CHOICES = 10;

    private final RestoreCoordinator coordinator;
    private final SystemPaths paths;
    private final ConfirmationPrompt prompt;
    private final Console console;
    private final PrintStream out;

    @Inject
    RestoreCommand(RestoreCoordinator coordinator, SystemPaths paths, ConfirmationPrompt prompt, Console console) {
        this.coordinator = coordinator;
        this.paths = paths;
        this.prompt = prompt;
        this.console = console;
        this.out = console.out();
    }

    @Override
    public int execute(CommandLine args) throws UsageException, LifecycleException, IOException {
        args.allowOnly(Set.of("file", "type", "list", "interactive", "history"));

        if (args.has("file")) {
            RestoreType type = RestoreType.parse(args.valueOr("type", RestoreType.AUTO.label()));
            return restore(resolve(args.value("file")), type);
        }
        if (args.has("type")) {
            throw new UsageException("--type needs --file");
        }
        if (args.has("interactive")) {
            return interactive();
        }
        if (args.has("history")) {
            return history(args.intValue("history", 10));
        }

        Path dir = args.values("list").isEmpty() ? paths.backups() : Path.of(args.value("list"));
        List<BackupArtifact> backups = coordinator.listAvailableBackups(dir);
        if (backups.isEmpty()) {
            out.printf("No backups found in %s%n", dir);
        }
        for (int i = 0; i < backups.size(); i++) {
            printBackup(i + 1, backups.get(i));
        }
        return LifecycleCli.OK;
    }

    /** Bare file names are looked up in the backup directory. */
    private Path resolve(String file) {
        Path path = Path.of(file);
        if (!Files.exists(path) && path.getParent() == null) {
            return paths.backups().resolve(file);
        }
        return path;
    }

    private int restore(Path file, RestoreType type) throws LifecycleException, IOException {
        try {
            RestoreOperation operation = coordinator.restoreFromBackup(file, type, prompt);
            out.printf("Restore completed%s%n",
                    operation.safetyBackup() == null ? "" : ", previous database kept at " + operation.safetyBackup());
            return LifecycleCli.OK;
        } catch (ConfirmationDeclinedException e) {
            out.println("Restore declined, nothing was changed");
            return LifecycleCli.FAILURE;
        }
    }

    private int interactive() throws LifecycleException, IOException {
        List<BackupArtifact> backups = coordinator.listAvailableBackups(paths.backups());
        if (backups.isEmpty()) {
            out.printf("No backups found in %s; create one with 'backup' first%n", paths.backups());
            return LifecycleCli.FAILURE;
        }
        int shown = Math.min(INTERACTIVE_CHOICES, backups.size());
        for (int i = 0; i < shown; i++) {
            printBackup(i + 1, backups.get(i));
        }
        String answer = console.ask("Select backup (1-" + shown + "), h for history, anything else to quit: ");
        if (answer == null) {
            return LifecycleCli.FAILURE;
        }
        answer = answer.trim();
        if (answer.equalsIgnoreCase("h")) {
            return history(10);
        }
        int choice;
        try {
            choice = Integer.parseInt(answer);
        } catch (NumberFormatException e) {
            out.println("No backup selected");
            return LifecycleCli.OK;
        }
        if (choice < 1 || choice > shown) {
            out.println("Invalid selection");
            return LifecycleCli.FAILURE;
        }
        return restore(backups.get(choice - 1).file(), RestoreType.AUTO);
    }

    private int history(int limit) {
        List<RestoreOperation> operations = coordinator.getRestoreHistory(limit);
        if (operations.isEmpty()) {
            out.println("No restore history");
        }
        for (RestoreOperation op : operations) {
            out.printf("%-8s %s  %-11s %s%n", op.status(), op.timestamp(), op.restoreType(),
                    Path.of(op.backupFile()).getFileName());
            if (op.notes() != null) {
                out.printf("         %s%n", op.notes());
            }
        }
        return LifecycleCli.OK;
    }

    private void printBackup(int index, BackupArtifact backup) {
        out.printf("%2d. %-45s %10s  %s  [%s]%n", index, backup.fileName(), ByteFormatter.format(backup.sizeBytes()),
                backup.modifiedAt(), backup.type());
    }
}
