package de.bsommerfeld.canary.cli;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.error.LifecycleException;
import de.bsommerfeld.canary.core.event.ApplicationEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Operator entry point: {@code canary-lifecycle <migrate|verify|archive|restore|backup> [options]}.
 *
 * <p>
 * Exit codes: {@code 0} success, {@code 1} failed operation or failed
 * items, {@code 2} usage error. The home directory comes from
 * {@code -Dcanary.home}, {@code CANARY_HOME} or the working directory.
 */
public final class LifecycleCli {

    private static final Logger LOG = LoggerFactory.getLogger(LifecycleCli.class);

    static final int OK = 0;
    static final int FAILURE = 1;
    static final int USAGE = 2;

    private static final Map<String, Class<? extends Command>> COMMANDS = Map.of(
            "migrate", MigrateCommand.class,
            "verify", VerifyCommand.class,
            "archive", ArchiveCommand.class,
            "restore", RestoreCommand.class,
            "backup", BackupCommand.class);

    private final Path home;
    private final Console console;

    public LifecycleCli(Path home, Console console) {
        this.home = home;
        this.console = console;
    }

    public static void main(String[] args) {
        Console console = new Console(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out);
        System.exit(new LifecycleCli(SystemPaths.resolveHome(), console).run(args));
    }

    public int run(String... args) {
        CommandLine commandLine;
        try {
            commandLine = CommandLine.parse(args);
        } catch (UsageException e) {
            return usage(e.getMessage());
        }
        Class<? extends Command> type = COMMANDS.get(commandLine.command());
        if (type == null) {
            return usage("Unknown command '" + commandLine.command() + "'");
        }

        Injector injector;
        try {
            injector = Guice.createInjector(new AppModule(home, console));
        } catch (CreationException e) {
            LOG.error("Startup failed", e);
            console.out().println("ERROR: " + rootMessage(e));
            return FAILURE;
        }

        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        ConsoleReporter reporter = injector.getInstance(ConsoleReporter.class);
        eventBus.register(reporter);
        try {
            return injector.getInstance(type).execute(commandLine);
        } catch (UsageException e) {
            return usage(e.getMessage());
        } catch (LifecycleException | IOException | RuntimeException e) {
            LOG.error("{} failed", commandLine.command(), e);
            console.out().println("ERROR: " + (e.getMessage() != null ? e.getMessage() : rootMessage(e)));
            return FAILURE;
        } finally {
            eventBus.unregister(reporter);
        }
    }

    private int usage(String problem) {
        console.out().println("ERROR: " + problem);
        console.out().println("Usage: canary-lifecycle <command> [options]");
        console.out().println("  migrate [--status | --rollback <version> | --target <version>"
                + " | --create <version> <description> --up <sql>... [--down <sql>...]]");
        console.out().println("  verify  [--run [dir] | --file <path> | --test-restore <path> | --history [days]]");
        console.out().println("  archive [--run | --table <name> | --summary | --dry-run | --restore <file> | --history [limit]]");
        console.out().println("  restore [--file <path> [--type auto|database|full_system] | --list [dir]"
                + " | --interactive | --history [limit]]");
        console.out().println("  backup  [--database | --full]");
        return USAGE;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
