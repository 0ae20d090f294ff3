package com.spreadsheet.reactive.engine;

import com.spreadsheet.reactive.models.CellAddress;

/**
 * Reads the value currently stored in a cell.
 */
@FunctionalInterface
public interface CellValueLookup {
    int valueOf(CellAddress address);
}
