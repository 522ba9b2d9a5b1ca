package de.bsommerfeld.canary.db.migration;

import java.util.Arrays;

/**
 * A dot-separated numeric version such as {@code 1.10.0}. Components compare
 * numerically, so {@code 1.10.0} sorts after {@code 1.2.0}; missing trailing
 * components count as zero.
 */
public final class MigrationVersion implements Comparable<MigrationVersion> {

    /** Version reported for a database without any applied migration. */
    public static final MigrationVersion ZERO = parse("0.0.0");

    private final String text;
    private final int[] components;

    private MigrationVersion(String text, int[] components) {
        this.text = text;
        this.components = components;
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not a dot-separated
     *                                  list of non-negative integers
     */
    public static MigrationVersion parse(String text) {
        if (text == null || !text.matches("\\d+(\\.\\d+)*")) {
            throw new IllegalArgumentException("Invalid migration version: " + text);
        }
        return new MigrationVersion(text, Arrays.stream(text.split("\\.")).mapToInt(Integer::parseInt).toArray());
    }

    public static boolean isValid(String text) {
        return text != null && text.matches("\\d+(\\.\\d+)*");
    }

    @Override
    public int compareTo(MigrationVersion other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int a = i < components.length ? components[i] : 0;
            int b = i < other.components.length ? other.components[i] : 0;
            if (a != b)
                return Integer.compare(a, b);
        }
        return 0;
    }

    public boolean isAfter(MigrationVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MigrationVersion))
            return false;
        return compareTo((MigrationVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        int end = components.length;
        while (end > 0 && components[end - 1] == 0)
            end--;
        return Arrays.hashCode(Arrays.copyOf(components, end));
    }

    @Override
    public String toString() {
        return text;
    }
}
