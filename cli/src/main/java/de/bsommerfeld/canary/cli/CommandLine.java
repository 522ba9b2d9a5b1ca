package de.bsommerfeld.canary.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code <command> [--flag [value...]]...}. Every token after a flag up to
 * the next flag is one of its values; repeating a flag appends values.
 */
final class CommandLine {

    private final String command;
    private final Map<String, List<String>> flags;

    private CommandLine(String command, Map<String, List<String>> flags) {
        this.command = command;
        this.flags = flags;
    }

    static CommandLine parse(String... args) throws UsageException {
        if (args.length == 0 || args[0].startsWith("--")) {
            throw new UsageException("Missing command");
        }
        Map<String, List<String>> flags = new LinkedHashMap<>();
        List<String> current = null;
        for (String token : Arrays.asList(args).subList(1, args.length)) {
            if (token.startsWith("--")) {
                current = flags.computeIfAbsent(token.substring(2), k -> new ArrayList<>());
            } else if (current == null) {
                throw new UsageException("Unexpected argument '" + token + "'");
            } else {
                current.add(token);
            }
        }
        return new CommandLine(args[0], flags);
    }

    String command() {
        return command;
    }

    boolean has(String flag) {
        return flags.containsKey(flag);
    }

    boolean isEmpty() {
        return flags.isEmpty();
    }

    List<String> values(String flag) {
        return flags.getOrDefault(flag, List.of());
    }

    /** The single value of {@code flag}. */
    String value(String flag) throws UsageException {
        List<String> values = values(flag);
        if (values.size() != 1) {
            throw new UsageException("--" + flag + " expects exactly one value");
        }
        return values.get(0);
    }

    String valueOr(String flag, String fallback) throws UsageException {
        return has(flag) ? value(flag) : fallback;
    }

    int intValue(String flag, int fallback) throws UsageException {
        if (!has(flag) || values(flag).isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value(flag));
        } catch (NumberFormatException e) {
            throw new UsageException("--" + flag + " expects a number, got '" + values(flag).get(0) + "'");
        }
    }

    /** Rejects flags outside {@code allowed}. */
    void allowOnly(Set<String> allowed) throws UsageException {
        for (String flag : flags.keySet()) {
            if (!allowed.contains(flag)) {
                throw new UsageException("Unknown option --" + flag + " for " + command);
            }
        }
    }
}
