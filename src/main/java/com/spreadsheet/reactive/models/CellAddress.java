package com.spreadsheet.reactive.models;

import com.spreadsheet.reactive.exceptions.CellOutOfBoundsException;
import com.spreadsheet.reactive.exceptions.InvalidCellIdException;

import java.util.Objects;

/**
 * Zero-based (row, column) coordinate of a cell.
 * The textual form is one uppercase column letter followed by a 1-based row, e.g. "C3".
 */
public final class CellAddress implements Comparable<CellAddress> {

    public static final int MAX_COLUMNS = 26;

    private final int row;
    private final int column;

    public CellAddress(int row, int column) {
        if (row < 0 || column < 0 || column >= MAX_COLUMNS) {
            throw new InvalidCellIdException("Invalid coordinates: row=" + row + ", column=" + column);
        }
        this.row = row;
        this.column = column;
    }

    /**
     * Parses a cell id such as "A1" or "Z120".
     * Throws InvalidCellIdException if the column is not A-Z or the row is not a positive integer,
     * CellOutOfBoundsException if the row is well-formed but does not fit an int.
     */
    public static CellAddress parse(String cellId) {
        if (cellId == null || cellId.length() < 2) {
            throw new InvalidCellIdException("Invalid cell id: " + cellId);
        }
        char columnChar = cellId.charAt(0);
        if (columnChar < 'A' || columnChar > 'Z') {
            throw new InvalidCellIdException("Invalid column in cell id: " + cellId);
        }

        String rowText = cellId.substring(1);
        // ASCII digits only; Integer.parseInt would also accept signs and other scripts' digits
        for (int i = 0; i < rowText.length(); i++) {
            char c = rowText.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidCellIdException("Invalid row in cell id: " + cellId);
            }
        }
        int row;
        try {
            row = Integer.parseInt(rowText);
        } catch (NumberFormatException e) {
            // Well-formed, just further down than any sheet can reach
            throw new CellOutOfBoundsException("Row out of range in cell id: " + cellId);
        }
        if (row < 1) {
            throw new InvalidCellIdException("Row must be at least 1 in cell id: " + cellId);
        }
        return new CellAddress(row - 1, columnChar - 'A');
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return (char) ('A' + column) + String.valueOf(row + 1);
    }
}
