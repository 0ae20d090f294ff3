package com.spreadsheet.reactive.models;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address in the sheet
 * - content (literal or formula)
 * - value (the current computed result, 0 by default)
 * - dependents: cells whose formula references this cell directly
 */
public class Cell {
    private final CellAddress address;
    private CellContent content = CellContent.literal(0);
    private int value;
    private final Set<CellAddress> dependents = new LinkedHashSet<>();

    public Cell(CellAddress address) {
        this.address = address;
    }

    public CellAddress getAddress() {
        return address;
    }

    public CellContent getContent() {
        return content;
    }

    public void setContent(CellContent content) {
        this.content = content;
    }

    public int getValue() {
        return value;
    }

    public void setValue(int value) {
        this.value = value;
    }

    public Set<CellAddress> getDependents() {
        return Collections.unmodifiableSet(dependents);
    }

    public boolean addDependent(CellAddress dependent) {
        return dependents.add(dependent);
    }

    public boolean removeDependent(CellAddress dependent) {
        return dependents.remove(dependent);
    }
}
