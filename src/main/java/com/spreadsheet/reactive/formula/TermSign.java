package com.spreadsheet.reactive.formula;

/**
 * Sign carried by a formula term: '+' adds the term, '-' subtracts it.
 */
public enum TermSign {
    PLUS('+'),
    MINUS('-');

    private final char symbol;

    TermSign(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public int apply(int magnitude) {
        return this == PLUS ? magnitude : -magnitude;
    }

    public static TermSign fromSymbol(char symbol) {
        switch (symbol) {
            case '+':
                return PLUS;
            case '-':
                return MINUS;
            default:
                throw new IllegalArgumentException("Not a sign: " + symbol);
        }
    }
}
