package com.spreadsheet.reactive.engine;

import com.spreadsheet.reactive.formula.Term;

import java.util.List;

/**
 * Sums signed terms left to right. References are read through the lookup as stored values;
 * nothing is recomputed from here, so referenced cells must already be up to date.
 * Overflow wraps like plain int arithmetic.
 */
public class FormulaEvaluator {

    public int evaluate(List<Term> terms, CellValueLookup lookup) {
        int result = 0;
        for (Term term : terms) {
            int magnitude = term.isReference() ? lookup.valueOf(term.getReference()) : term.getLiteral();
            result += term.getSign().apply(magnitude);
        }
        return result;
    }
}
