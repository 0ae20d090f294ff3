package com.spreadsheet.reactive.models;

import com.spreadsheet.reactive.formula.Term;

import java.util.Collections;
import java.util.List;

/**
 * What a cell holds: either a literal integer or a formula.
 * Exactly one of the two is present, selected by {@link Kind}.
 */
public final class CellContent {

    public enum Kind {
        LITERAL,
        FORMULA
    }

    private static final CellContent ZERO = new CellContent(Kind.LITERAL, 0, null, Collections.emptyList());

    private final Kind kind;
    private final int literal;
    private final String formulaText;
    // Parsed once when the formula is installed, reused on every recompute
    private final List<Term> terms;

    private CellContent(Kind kind, int literal, String formulaText, List<Term> terms) {
        this.kind = kind;
        this.literal = literal;
        this.formulaText = formulaText;
        this.terms = terms;
    }

    public static CellContent literal(int value) {
        return value == 0 ? ZERO : new CellContent(Kind.LITERAL, value, null, Collections.emptyList());
    }

    public static CellContent formula(String formulaText, List<Term> terms) {
        return new CellContent(Kind.FORMULA, 0, formulaText, List.copyOf(terms));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFormula() {
        return kind == Kind.FORMULA;
    }

    public int getLiteral() {
        if (kind != Kind.LITERAL) {
            throw new IllegalStateException("Formula content has no literal value");
        }
        return literal;
    }

    public String getFormulaText() {
        if (kind != Kind.FORMULA) {
            throw new IllegalStateException("Literal content has no formula");
        }
        return formulaText;
    }

    /**
     * Parsed terms of the formula; empty for literals.
     */
    public List<Term> getTerms() {
        return terms;
    }

    @Override
    public String toString() {
        return kind == Kind.FORMULA ? formulaText : String.valueOf(literal);
    }
}
