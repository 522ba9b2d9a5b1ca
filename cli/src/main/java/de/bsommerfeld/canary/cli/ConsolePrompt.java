package de.bsommerfeld.canary.cli;

import com.google.inject.Inject;
import de.bsommerfeld.canary.restore.ConfirmationPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/** Asks on the console; only {@code y} or {@code yes} approves. */
public class ConsolePrompt implements ConfirmationPrompt {

    private static final Logger LOG = LoggerFactory.getLogger(ConsolePrompt.class);

    private final Console console;

    @Inject
    public ConsolePrompt(Console console) {
        this.console = console;
    }

    @Override
    public boolean confirm(String question) {
        try {
            String answer = console.ask(question + " (y/N): ");
            if (answer == null) {
                LOG.info("No answer on console, treating as declined");
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read confirmation", e);
        }
    }
}
