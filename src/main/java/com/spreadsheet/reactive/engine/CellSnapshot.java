package com.spreadsheet.reactive.engine;

import java.util.List;

/**
 * Read-only view of a cell for callers outside the engine.
 * 'formula' is null when the cell holds a literal.
 */
public class CellSnapshot {
    private final String cellId;
    private final int value;
    private final String formula;
    private final List<String> dependents;

    public CellSnapshot(String cellId, int value, String formula, List<String> dependents) {
        this.cellId = cellId;
        this.value = value;
        this.formula = formula;
        this.dependents = List.copyOf(dependents);
    }

    public String getCellId() {
        return cellId;
    }

    public int getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public List<String> getDependents() {
        return dependents;
    }
}
