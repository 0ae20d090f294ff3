package com.spreadsheet.reactive.engine;

import com.spreadsheet.reactive.formula.FormulaParser;
import com.spreadsheet.reactive.models.CellAddress;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormulaEvaluatorTest {

    private final FormulaParser parser = new FormulaParser();
    private final FormulaEvaluator evaluator = new FormulaEvaluator();

    private final Map<CellAddress, Integer> values = Map.of(
            CellAddress.parse("A1"), 10,
            CellAddress.parse("B1"), 4,
            CellAddress.parse("A2"), 5
    );
    private final CellValueLookup lookup = address -> values.getOrDefault(address, 0);

    @Test
    void testAdditionAndSubtraction() {
        assertEquals(10 - 4 + 7, evaluator.evaluate(parser.parse("=A1-B1+7"), lookup));
    }

    @Test
    void testRangeSum() {
        // A1 + B1 + A2 + B2
        assertEquals(19, evaluator.evaluate(parser.parse("=A1:B2"), lookup));
        assertEquals(-19, evaluator.evaluate(parser.parse("=-A1:B2"), lookup));
    }

    @Test
    void testEmptyTermsEvaluateToZero() {
        assertEquals(0, evaluator.evaluate(Collections.emptyList(), lookup));
    }

    @Test
    void testRepeatedReferenceCountsEachTime() {
        assertEquals(20, evaluator.evaluate(parser.parse("=A1+A1"), lookup));
        assertEquals(0, evaluator.evaluate(parser.parse("=A1-A1"), lookup));
    }
}
