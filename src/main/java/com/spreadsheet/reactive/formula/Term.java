package com.spreadsheet.reactive.formula;

import com.spreadsheet.reactive.models.CellAddress;

import java.util.Objects;

/**
 * One signed operand of a formula: an integer literal or a single-cell reference.
 * Ranges never appear here; the parser expands them into one reference per cell.
 */
public final class Term {

    private final TermSign sign;
    private final int literal;
    private final CellAddress reference;

    private Term(TermSign sign, int literal, CellAddress reference) {
        this.sign = sign;
        this.literal = literal;
        this.reference = reference;
    }

    public static Term literal(TermSign sign, int value) {
        return new Term(sign, value, null);
    }

    public static Term reference(TermSign sign, CellAddress address) {
        return new Term(sign, 0, Objects.requireNonNull(address, "address"));
    }

    public TermSign getSign() {
        return sign;
    }

    public boolean isReference() {
        return reference != null;
    }

    public int getLiteral() {
        return literal;
    }

    /**
     * Referenced cell, or null for a literal term.
     */
    public CellAddress getReference() {
        return reference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Term)) {
            return false;
        }
        Term term = (Term) o;
        return literal == term.literal && sign == term.sign && Objects.equals(reference, term.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sign, literal, reference);
    }

    @Override
    public String toString() {
        return sign.getSymbol() + (isReference() ? reference.toString() : String.valueOf(literal));
    }
}
