package com.spreadsheet.reactive.models;

import com.spreadsheet.reactive.exceptions.CellOutOfBoundsException;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID
 * - Fixed dimensions, columns capped at 26
 * - A dense grid of cells, all created up front with value 0
 *
 * A sheet does no locking of its own; whoever shares it between threads must serialize access.
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final int rows;
    private final int columns;
    private final Cell[][] cells;

    public Sheet(int rows, int requestedColumns) {
        if (rows < 1 || requestedColumns < 1) {
            throw new IllegalArgumentException(
                    "Sheet needs at least one row and one column, got " + rows + "x" + requestedColumns);
        }
        this.id = ID_GENERATOR.getAndIncrement();
        this.rows = rows;
        this.columns = Math.min(requestedColumns, CellAddress.MAX_COLUMNS);
        this.cells = new Cell[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                cells[r][c] = new Cell(new CellAddress(r, c));
            }
        }
    }

    public long getId() {
        return id;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public boolean contains(CellAddress address) {
        return address.getRow() < rows && address.getColumn() < columns;
    }

    /**
     * Returns the cell at the given address, or throws CellOutOfBoundsException.
     */
    public Cell getCell(CellAddress address) {
        if (!contains(address)) {
            throw new CellOutOfBoundsException(
                    "Cell " + address + " is outside the " + rows + "x" + columns + " sheet");
        }
        return cells[address.getRow()][address.getColumn()];
    }
}
