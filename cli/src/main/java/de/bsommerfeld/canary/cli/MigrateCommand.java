package de.bsommerfeld.canary.cli;

import com.google.inject.Inject;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.db.migration.MigrationResult;
import de.bsommerfeld.canary.db.migration.MigrationStatus;
import de.bsommerfeld.canary.db.migration.SchemaMigrationEngine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** {@code migrate [--status | --rollback <version> | --target <version> | --create <version> <description> --up <sql>... [--down <sql>...]]} */
class MigrateCommand implements Command {

    private final SchemaMigrationEngine engine;
    private final PrintStream out;

    @Inject
    MigrateCommand(SchemaMigrationEngine engine, Console console) {
        this.engine = engine;
        this.out = console.out();
    }

    @Override
    public int execute(CommandLine args) throws UsageException, LifecycleException, IOException {
        args.allowOnly(Set.of("status", "rollback", "target", "create", "up", "down"));

        if (args.has("status")) {
            return status();
        }
        if (args.has("rollback")) {
            String version = args.value("rollback");
            engine.rollback(version);
            out.printf("Rolled back %s, schema now at %s%n", version, engine.getCurrentVersion());
            return LifecycleCli.OK;
        }
        if (args.has("create")) {
            return create(args);
        }

        String target = args.has("target") ? args.value("target") : null;
        MigrationResult result = engine.applyPending(target);
        if (result.appliedCount() == 0) {
            out.printf("Schema up to date at %s%n", result.currentVersion());
        } else {
            out.printf("Applied %d migrations, schema now at %s%n", result.appliedCount(), result.currentVersion());
        }
        return LifecycleCli.OK;
    }

    private int status() throws LifecycleException {
        MigrationStatus status = engine.status();
        out.printf("Current version: %s%n", status.currentVersion());
        out.printf("Applied: %d  Pending: %d%n", status.appliedCount(), status.pendingCount());
        status.pending().forEach(v -> out.printf("  pending %s%n", v));
        status.drifted().forEach(v -> out.printf("  DRIFT   %s (definition changed after it was applied)%n", v));
        return status.drifted().isEmpty() ? LifecycleCli.OK : LifecycleCli.FAILURE;
    }

    private int create(CommandLine args) throws UsageException, LifecycleException, IOException {
        List<String> values = args.values("create");
        if (values.size() < 2) {
            throw new UsageException("--create expects <version> <description>");
        }
        if (args.values("up").isEmpty()) {
            throw new UsageException("--create needs at least one --up statement");
        }
        String description = String.join(" ", values.subList(1, values.size()));
        Path file = engine.createMigrationFile(values.get(0), description, args.values("up"), args.values("down"));
        out.printf("Created %s%n", file);
        return LifecycleCli.OK;
    }
}
