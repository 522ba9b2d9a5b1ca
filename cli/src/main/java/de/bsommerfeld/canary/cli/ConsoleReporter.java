package de.bsommerfeld.canary.cli;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import de.bsommerfeld.canary.core.event.LifecycleEvents.ArchiveItemCompletedEvent;
import de.bsommerfeld.canary.core.event.LifecycleEvents.BackupVerifiedEvent;
import de.bsommerfeld.canary.core.event.LifecycleEvents.MigrationAppliedEvent;
import de.bsommerfeld.canary.core.event.LifecycleEvents.MigrationRolledBackEvent;
import de.bsommerfeld.canary.core.event.LifecycleEvents.RestoreCompletedEvent;

import java.io.PrintStream;

/**
 * Prints one line per completed unit of work while a command runs.
 */
public class ConsoleReporter {

    private final PrintStream out;

    @Inject
    public ConsoleReporter(Console console) {
        this.out = console.out();
    }

    @Subscribe
    public void onMigrationApplied(MigrationAppliedEvent event) {
        out.printf("  applied     %s  %s%n", event.version(), event.description());
    }

    @Subscribe
    public void onMigrationRolledBack(MigrationRolledBackEvent event) {
        out.printf("  rolled back %s%n", event.version());
    }

    @Subscribe
    public void onBackupVerified(BackupVerifiedEvent event) {
        String detail = event.errorCount() == 0 ? "" : "  (" + event.errorCount() + " errors)";
        out.printf("  %-5s %s%s%n", event.status(), event.backupFile().getFileName(), detail);
    }

    @Subscribe
    public void onArchiveItem(ArchiveItemCompletedEvent event) {
        if (event.error() != null) {
            out.printf("  FAIL  %-28s %s%n", event.item(), event.error());
        } else if (event.archiveFile() == null) {
            out.printf("  PASS  %-28s nothing to archive%n", event.item());
        } else {
            out.printf("  PASS  %-28s %d archived -> %s%n", event.item(), event.archived(),
                    event.archiveFile().getFileName());
        }
    }

    @Subscribe
    public void onRestoreCompleted(RestoreCompletedEvent event) {
        out.printf("  %s restore from %s: %s%n", event.restoreType(), event.backupFile().getFileName(),
                event.status());
    }
}
