package com.spreadsheet.reactive.formula;

import com.spreadsheet.reactive.exceptions.FormulaParseException;
import com.spreadsheet.reactive.exceptions.InvalidCellIdException;
import com.spreadsheet.reactive.models.CellAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns formula text such as "=A1+B2-C3+10+A2:B3" into a flat list of signed terms.
 * <p>
 * Rules:
 * - the text must start with '='
 * - terms are separated by '+' or '-'; a single leading sign applies to the first term
 * - each term is an integer, a cell id, or a range "TopLeft:BottomRight"
 * - a range expands row by row into one reference per cell, all with the range's sign
 * - "=" on its own is an empty formula and yields no terms
 * <p>
 * Stateless; safe to share.
 */
public class FormulaParser {

    public static final char FORMULA_MARKER = '=';
    private static final char RANGE_SEPARATOR = ':';

    public List<Term> parse(String formulaText) {
        if (formulaText == null || formulaText.isEmpty() || formulaText.charAt(0) != FORMULA_MARKER) {
            throw new FormulaParseException("Formula must start with '" + FORMULA_MARKER + "': " + formulaText);
        }
        String body = formulaText.substring(1);
        if (body.trim().isEmpty()) {
            return Collections.emptyList();
        }

        List<Term> terms = new ArrayList<>();
        TermSign sign = TermSign.PLUS;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '+' && c != '-') {
                continue;
            }
            String token = body.substring(start, i).trim();
            if (token.isEmpty()) {
                // Only the very first operand may be preceded by a bare sign
                if (start != 0 || !terms.isEmpty()) {
                    throw new FormulaParseException("Missing operand before '" + c + "' in " + formulaText);
                }
            } else {
                addToken(terms, token, sign, formulaText);
            }
            sign = TermSign.fromSymbol(c);
            start = i + 1;
        }

        String last = body.substring(start).trim();
        if (last.isEmpty()) {
            throw new FormulaParseException("Formula ends without an operand: " + formulaText);
        }
        addToken(terms, last, sign, formulaText);
        return terms;
    }

    private void addToken(List<Term> terms, String token, TermSign sign, String formulaText) {
        Integer literal = tryParseInt(token);
        if (literal != null) {
            terms.add(Term.literal(sign, literal));
        } else if (token.indexOf(RANGE_SEPARATOR) >= 0) {
            expandRange(terms, token, sign, formulaText);
        } else {
            terms.add(Term.reference(sign, resolve(token, formulaText)));
        }
    }

    private void expandRange(List<Term> terms, String token, TermSign sign, String formulaText) {
        String[] ends = token.split(String.valueOf(RANGE_SEPARATOR), -1);
        if (ends.length != 2) {
            throw new FormulaParseException("Malformed range '" + token + "' in " + formulaText);
        }
        CellAddress topLeft = resolve(ends[0].trim(), formulaText);
        CellAddress bottomRight = resolve(ends[1].trim(), formulaText);
        if (topLeft.getRow() > bottomRight.getRow() || topLeft.getColumn() > bottomRight.getColumn()) {
            throw new FormulaParseException(
                    "Range must run from top-left to bottom-right, got '" + token + "' in " + formulaText);
        }

        for (int r = topLeft.getRow(); r <= bottomRight.getRow(); r++) {
            for (int c = topLeft.getColumn(); c <= bottomRight.getColumn(); c++) {
                terms.add(Term.reference(sign, new CellAddress(r, c)));
            }
        }
    }

    private CellAddress resolve(String cellId, String formulaText) {
        try {
            return CellAddress.parse(cellId);
        } catch (InvalidCellIdException e) {
            throw new FormulaParseException("Unknown token '" + cellId + "' in " + formulaText, e);
        }
    }

    private static Integer tryParseInt(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
