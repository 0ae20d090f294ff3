package com.spreadsheet.reactive.engine;

import com.spreadsheet.reactive.models.CellAddress;

import java.util.List;

/**
 * Outcome of a successful setCellValue: the cell written, its new value,
 * and the dependents that were recomputed, in the order they were recomputed.
 */
public class RecalculationResult {
    private final CellAddress updated;
    private final int value;
    private final List<CellAddress> recomputed;

    public RecalculationResult(CellAddress updated, int value, List<CellAddress> recomputed) {
        this.updated = updated;
        this.value = value;
        this.recomputed = List.copyOf(recomputed);
    }

    public CellAddress getUpdated() {
        return updated;
    }

    public int getValue() {
        return value;
    }

    public List<CellAddress> getRecomputed() {
        return recomputed;
    }
}
