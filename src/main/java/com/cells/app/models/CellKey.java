package com.cells.app.models;

import com.cells.app.exceptions.InvalidCellKeyException;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of one grid position: a column letter plus a 1-based row.
 * Keys are value objects; two keys for the same position are equal.
 */
public final class CellKey implements Comparable<CellKey> {

    public static final int MAX_ROW = 99;

    private static final Comparator<CellKey> ORDER =
            Comparator.comparing(CellKey::getColumn).thenComparingInt(CellKey::getRow);

    private final ColumnKey column;
    private final int row;

    private CellKey(ColumnKey column, int row) {
        this.column = column;
        this.row = row;
    }

    public static CellKey of(ColumnKey column, int row) {
        Objects.requireNonNull(column, "column");
        if (!isValidRow(row)) {
            throw new InvalidCellKeyException("Row " + row + " is outside 1.." + MAX_ROW);
        }
        return new CellKey(column, row);
    }

    public static boolean isValidRow(int row) {
        return row >= 1 && row <= MAX_ROW;
    }

    /**
     * Parses the addressing syntax used in formulas and in the REST paths,
     * e.g. "A1" or "c12". The column letter is case-insensitive.
     */
    public static CellKey parse(String text) {
        if (text == null || text.length() < 2) {
            throw new InvalidCellKeyException("Invalid cell key: " + text);
        }
        ColumnKey column = ColumnKey.tryOf(text.charAt(0)).orElseThrow(() ->
                new InvalidCellKeyException("Invalid cell key: " + text));
        String digits = text.substring(1);
        if (!digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new InvalidCellKeyException("Invalid cell key: " + text);
        }
        return of(column, parseRow(digits));
    }

    /**
     * Reads a row number from ASCII digits, ignoring leading zeros.
     *
     * @return the row, or -1 if it has too many significant digits to be a row
     */
    public static int parseRow(String digits) {
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        String significant = digits.substring(start);
        // at most three digits keeps Integer.parseInt from overflowing
        return significant.length() > 3 ? -1 : Integer.parseInt(significant);
    }

    public ColumnKey getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int compareTo(CellKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellKey)) {
            return false;
        }
        CellKey other = (CellKey) o;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return column.getIndex() * 128 + row;
    }

    @Override
    public String toString() {
        return column.toString() + row;
    }
}
