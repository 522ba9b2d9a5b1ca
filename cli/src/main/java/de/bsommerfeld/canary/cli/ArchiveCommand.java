package de.bsommerfeld.canary.cli;

import com.google.inject.Inject;
import de.bsommerfeld.canary.archive.ArchivalRecord;
import de.bsommerfeld.canary.archive.ArchivalReport;
import de.bsommerfeld.canary.archive.ArchiveRestoreResult;
import de.bsommerfeld.canary.archive.ArchiveResult;
import de.bsommerfeld.canary.archive.ArchiveSummary;
import de.bsommerfeld.canary.archive.CandidateCount;
import de.bsommerfeld.canary.archive.DataArchivalManager;
import de.bsommerfeld.canary.core.concurrent.CancellationToken;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.core.util.ByteFormatter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** {@code archive [--run | --table <name> | --summary | --dry-run | --restore <file> | --history [limit]]} */
class ArchiveCommand implements Command {

    private final DataArchivalManager archival;
    private final PrintStream out;

    @Inject
    ArchiveCommand(DataArchivalManager archival, Console console) {
        this.archival = archival;
        this.out = console.out();
    }

    @Override
    public int execute(CommandLine args) throws UsageException, LifecycleException, IOException {
        args.allowOnly(Set.of("run", "table", "summary", "dry-run", "restore", "history"));

        if (args.has("table")) {
            String table = args.value("table");
            ArchiveResult result = DataArchivalManager.LOGS_ITEM.equals(table)
                    ? archival.archiveLogs()
                    : archival.archiveTable(table);
            out.printf("%s: %d archived%s%n", result.item(), result.archivedCount(),
                    result.archiveFile() == null ? "" : " -> " + result.archiveFile());
            return LifecycleCli.OK;
        }
        if (args.has("summary")) {
            return summary();
        }
        if (args.has("dry-run")) {
            return dryRun();
        }
        if (args.has("restore")) {
            ArchiveRestoreResult result = archival.restoreFromArchive(Path.of(args.value("restore")));
            out.printf("Restored %d rows into %s (%d already present)%n", result.restored(), result.table(),
                    result.skipped());
            return LifecycleCli.OK;
        }
        if (args.has("history")) {
            return history(args.intValue("history", 20));
        }

        ArchivalReport report = archival.runFullArchival(CancellationToken.none());
        out.printf("Archived %d records, %d failed items%n", report.totalArchived(), report.failedItems());
        return report.failedItems() == 0 ? LifecycleCli.OK : LifecycleCli.FAILURE;
    }

    private int summary() throws IOException {
        ArchiveSummary summary = archival.getArchiveSummary();
        out.printf("%d archive files, %s%n", summary.totalFiles(), ByteFormatter.format(summary.totalBytes()));
        summary.byType().forEach((kind, totals) -> out.printf("  %-15s %3d files  %s%n", kind, totals.files(),
                ByteFormatter.format(totals.bytes())));
        if (summary.oldest() != null) {
            out.printf("  oldest %s, newest %s%n", summary.oldest(), summary.newest());
        }
        return LifecycleCli.OK;
    }

    private int dryRun() {
        for (CandidateCount count : archival.dryRun()) {
            if (count.error() != null) {
                out.printf("  %-28s skipped: %s%n", count.table(), count.error());
            } else {
                out.printf("  %-28s %6d rows older than %s (%d days)%n", count.table(), count.candidates(),
                        count.cutoff(), count.retentionDays());
            }
        }
        return LifecycleCli.OK;
    }

    private int history(int limit) {
        List<ArchivalRecord> records = archival.getArchiveHistory(limit);
        if (records.isEmpty()) {
            out.println("No archival history");
        }
        for (ArchivalRecord record : records) {
            out.printf("%s  %-28s %6d rows  cutoff %s  %s%n", record.createdAt(), record.tableName(),
                    record.archivedCount(), record.cutoff(), Path.of(record.archiveFile()).getFileName());
        }
        return LifecycleCli.OK;
    }
}
