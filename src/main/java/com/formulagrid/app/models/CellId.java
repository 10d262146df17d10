package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.formulagrid.app.exceptions.InvalidCellIdException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies one cell of the 10x10 grid: a column letter A-J followed by a
 * row number 1-10, e.g. "A1" or "J10".
 * Ids are interned, so the 100 instances returned by {@link #all()} are the
 * only ones that ever exist. Ordering is row-major (A1, B1, ..., J1, A2, ...).
 */
public final class CellId implements Comparable<CellId> {

    public static final int COLUMNS = 10;
    public static final int ROWS = 10;
    public static final String COLUMN_LABELS = "ABCDEFGHIJ";

    /** Grammar of a reference token; "10" is tried before the single digit. */
    public static final String REFERENCE_REGEX = "[A-J](10|[1-9])";

    private static final Pattern ID_PATTERN = Pattern.compile("^" + REFERENCE_REGEX + "$");

    private static final CellId[][] GRID = new CellId[ROWS][COLUMNS];
    private static final List<CellId> ALL;

    static {
        List<CellId> all = new ArrayList<>(ROWS * COLUMNS);
        for (int row = 1; row <= ROWS; row++) {
            for (int col = 0; col < COLUMNS; col++) {
                CellId id = new CellId(COLUMN_LABELS.charAt(col), row);
                GRID[row - 1][col] = id;
                all.add(id);
            }
        }
        ALL = Collections.unmodifiableList(all);
    }

    private final char column;
    private final int row;
    private final String text;

    private CellId(char column, int row) {
        this.column = column;
        this.row = row;
        this.text = String.valueOf(column) + row;
    }

    /**
     * Parses "A1".."J10". Anything else, including lower case letters or
     * surrounding whitespace, is rejected.
     */
    public static CellId parse(String text) {
        if (text == null) {
            throw new InvalidCellIdException("Invalid cell id: null");
        }
        Matcher matcher = ID_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidCellIdException("Invalid cell id: " + text);
        }
        return of(text.charAt(0), Integer.parseInt(matcher.group(1)));
    }

    public static CellId of(char column, int row) {
        int col = COLUMN_LABELS.indexOf(column);
        if (col < 0 || row < 1 || row > ROWS) {
            throw new InvalidCellIdException("Invalid cell id: " + column + row);
        }
        return GRID[row - 1][col];
    }

    /** All 100 ids in row-major order. */
    public static List<CellId> all() {
        return ALL;
    }

    public char getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int compareTo(CellId other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Character.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellId)) {
            return false;
        }
        CellId other = (CellId) o;
        return column == other.column && row == other.row;
    }

    @Override
    public int hashCode() {
        return 31 * column + row;
    }

    @JsonValue
    @Override
    public String toString() {
        return text;
    }
}
