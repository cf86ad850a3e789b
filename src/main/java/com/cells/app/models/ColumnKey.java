package com.cells.app.models;

import com.cells.app.exceptions.InvalidCellKeyException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One of the 26 letter-addressed grid columns, A through Z.
 * Instances are cached, so identity comparison is safe.
 */
public final class ColumnKey implements Comparable<ColumnKey> {

    public static final int COUNT = 26;

    private static final ColumnKey[] COLUMNS = new ColumnKey[COUNT];

    static {
        for (int i = 0; i < COUNT; i++) {
            COLUMNS[i] = new ColumnKey((char) ('A' + i));
        }
    }

    private final char letter;

    private ColumnKey(char letter) {
        this.letter = letter;
    }

    /**
     * Looks up a column from a letter as typed in formula text.
     * Lowercase letters are normalized to uppercase.
     */
    public static Optional<ColumnKey> tryOf(char c) {
        if (c >= 'a' && c <= 'z') {
            c = (char) (c - 'a' + 'A');
        }
        if (c < 'A' || c > 'Z') {
            return Optional.empty();
        }
        return Optional.of(COLUMNS[c - 'A']);
    }

    public static ColumnKey of(char c) {
        return tryOf(c).orElseThrow(() ->
                new InvalidCellKeyException("Not a column letter: '" + c + "'"));
    }

    /**
     * Case-exact lookup of a display label such as "C".
     */
    public static ColumnKey fromLabel(String label) {
        if (label == null || label.length() != 1 || label.charAt(0) < 'A' || label.charAt(0) > 'Z') {
            throw new InvalidCellKeyException("Not a column label: " + label);
        }
        return COLUMNS[label.charAt(0) - 'A'];
    }

    public static List<ColumnKey> all() {
        return Collections.unmodifiableList(Arrays.asList(COLUMNS));
    }

    /** Zero-based position, A = 0. */
    public int getIndex() {
        return letter - 'A';
    }

    @Override
    public int compareTo(ColumnKey other) {
        return Character.compare(letter, other.letter);
    }

    @Override
    public String toString() {
        return String.valueOf(letter);
    }
}
