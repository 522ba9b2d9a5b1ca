package de.bsommerfeld.canary.cli;

import com.google.inject.AbstractModule;
import de.bsommerfeld.canary.core.concurrent.DatabaseLock;
import de.bsommerfeld.canary.core.config.ArchivalConfig;
import de.bsommerfeld.canary.core.config.ConfigLoader;
import de.bsommerfeld.canary.core.config.LifecycleConfig;
import de.bsommerfeld.canary.core.config.RestoreConfig;
import de.bsommerfeld.canary.core.config.SystemPaths;
import de.bsommerfeld.canary.core.config.VerificationConfig;
import de.bsommerfeld.canary.db.ConnectionFactory;
import de.bsommerfeld.canary.db.SqliteTransactor;
import de.bsommerfeld.canary.db.Transactor;
import de.bsommerfeld.canary.db.migration.MigrationCatalog;
import de.bsommerfeld.canary.restore.ConfirmationPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the command line. The configuration is read once from
 * {@code <home>/config/lifecycle.yaml} and bound together with its sections.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path home;
    private final Console console;

    public AppModule(Path home, Console console) {
        this.home = home;
        this.console = console;
    }

    @Override
    protected void configure() {
        LifecycleConfig config;
        try {
            config = ConfigLoader.load(SystemPaths.configFile(home));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load lifecycle configuration below " + home, e);
        }
        SystemPaths paths = SystemPaths.of(home, config.getPaths());
        LOG.info("Home {}, database {}", paths.home(), paths.database());

        bind(LifecycleConfig.class).toInstance(config);
        bind(VerificationConfig.class).toInstance(config.getVerification());
        bind(ArchivalConfig.class).toInstance(config.getArchival());
        bind(RestoreConfig.class).toInstance(config.getRestore());
        bind(SystemPaths.class).toInstance(paths);

        bind(Clock.class).toInstance(Clock.systemDefaultZone());
        bind(DatabaseLock.class).toInstance(new DatabaseLock(paths.database()));
        ConnectionFactory connections = new ConnectionFactory(paths.database());
        bind(ConnectionFactory.class).toInstance(connections);
        bind(Transactor.class).toInstance(new SqliteTransactor(connections));
        bind(MigrationCatalog.class).toInstance(new MigrationCatalog(paths.migrations()));

        bind(Console.class).toInstance(console);
        bind(ConfirmationPrompt.class).to(ConsolePrompt.class);
    }
}
