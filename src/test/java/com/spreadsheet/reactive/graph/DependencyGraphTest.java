package com.spreadsheet.reactive.graph;

import com.spreadsheet.reactive.exceptions.CircularReferenceException;
import com.spreadsheet.reactive.formula.FormulaParser;
import com.spreadsheet.reactive.models.CellAddress;
import com.spreadsheet.reactive.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private final FormulaParser parser = new FormulaParser();
    private Sheet sheet;
    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        sheet = new Sheet(5, 5);
        graph = new DependencyGraph(sheet);
    }

    private static CellAddress at(String cellId) {
        return CellAddress.parse(cellId);
    }

    private void link(String owner, String formula) {
        graph.addDependencies(at(owner), parser.parse(formula));
    }

    @Test
    void testAddAndRemoveAreSymmetric() {
        link("C3", "=A1:B2+A1");
        assertEquals(Set.of(at("C3")), graph.directDependents(at("A1")));
        assertEquals(Set.of(at("C3")), graph.directDependents(at("B2")));

        graph.removeDependencies(at("C3"), parser.parse("=A1:B2+A1"));
        assertTrue(graph.directDependents(at("A1")).isEmpty());
        assertTrue(graph.directDependents(at("B2")).isEmpty());
    }

    @Test
    void testRemoveOnlyTouchesOwner() {
        link("B1", "=A1");
        link("C1", "=A1");
        graph.removeDependencies(at("B1"), parser.parse("=A1"));
        assertEquals(Set.of(at("C1")), graph.directDependents(at("A1")));
    }

    /**
     * Diamond: B1 and C1 read A1, D1 reads both. D1 must come after B1 and C1, and only once.
     */
    @Test
    void testTransitiveDependentsAreTopologicallyOrdered() {
        link("B1", "=A1");
        link("C1", "=A1+B1");
        link("D1", "=B1+C1");
        link("E1", "=D1");

        List<CellAddress> order = graph.transitiveDependents(at("A1"));
        assertEquals(4, order.size());
        assertEquals(4, Set.copyOf(order).size());
        assertTrue(order.indexOf(at("B1")) < order.indexOf(at("C1")));
        assertTrue(order.indexOf(at("C1")) < order.indexOf(at("D1")));
        assertTrue(order.indexOf(at("D1")) < order.indexOf(at("E1")));
        assertFalse(order.contains(at("A1")));
    }

    @Test
    void testUnreferencedCellHasNoDependents() {
        link("B1", "=A1");
        assertTrue(graph.transitiveDependents(at("E5")).isEmpty());
        assertEquals(List.of(at("B1")), graph.transitiveDependents(at("A1")));
    }

    @Test
    void testCycleDetected() {
        link("B1", "=A1");
        link("C1", "=B1");
        link("A1", "=C1");
        assertThrows(CircularReferenceException.class, () -> graph.transitiveDependents(at("A1")));
    }

    @Test
    void testSelfReferenceDetected() {
        link("A1", "=A1+1");
        assertThrows(CircularReferenceException.class, () -> graph.transitiveDependents(at("A1")));
    }

    /**
     * A long chain is walked without recursion.
     */
    @Test
    void testLongChain() {
        Sheet tall = new Sheet(5000, 1);
        DependencyGraph tallGraph = new DependencyGraph(tall);
        for (int row = 2; row <= 5000; row++) {
            tallGraph.addDependencies(at("A" + row), parser.parse("=A" + (row - 1)));
        }
        List<CellAddress> order = tallGraph.transitiveDependents(at("A1"));
        assertEquals(4999, order.size());
        assertEquals(at("A2"), order.get(0));
        assertEquals(at("A5000"), order.get(4998));
    }
}
