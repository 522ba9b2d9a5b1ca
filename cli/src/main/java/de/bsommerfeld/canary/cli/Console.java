package de.bsommerfeld.canary.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/** Operator input and output streams. */
public final class Console {

    private final BufferedReader in;
    private final PrintStream out;

    public Console(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public PrintStream out() {
        return out;
    }

    /** Prints {@code prompt} and reads one line; {@code null} at end of input. */
    public String ask(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        return in.readLine();
    }
}
