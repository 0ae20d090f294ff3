package com.spreadsheet.reactive.engine;

import com.spreadsheet.reactive.exceptions.CircularReferenceException;
import com.spreadsheet.reactive.formula.FormulaParser;
import com.spreadsheet.reactive.formula.Term;
import com.spreadsheet.reactive.graph.DependencyGraph;
import com.spreadsheet.reactive.models.Cell;
import com.spreadsheet.reactive.models.CellAddress;
import com.spreadsheet.reactive.models.CellContent;
import com.spreadsheet.reactive.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes and reads cell values, keeping every formula cell consistent with what it references.
 * The sheet is always passed in; the engine itself holds no sheet state.
 */
public class PropagationEngine {

    private static final Logger logger = LoggerFactory.getLogger(PropagationEngine.class);

    private final FormulaParser parser;
    private final FormulaEvaluator evaluator;

    public PropagationEngine(FormulaParser parser, FormulaEvaluator evaluator) {
        this.parser = parser;
        this.evaluator = evaluator;
    }

    /**
     * Sets a cell to a literal or a formula with these steps:
     * 1) Resolve the cell id and normalize blank input to "0".
     * 2) Parse the new content and check its references fit the sheet (nothing mutated yet).
     * 3) Swap the old formula's edges for the new one's and install the content.
     * 4) Collect transitive dependents; on a cycle, restore content and edges and rethrow.
     * 5) Compute the cell, then recompute each dependent in topological order.
     */
    public RecalculationResult setCellValue(Sheet sheet, String cellId, String rawValue) {
        CellAddress address = CellAddress.parse(cellId);
        Cell cell = sheet.getCell(address);
        String raw = (rawValue == null || rawValue.trim().isEmpty()) ? "0" : rawValue.trim();

        CellContent newContent = toContent(sheet, raw);
        CellContent oldContent = cell.getContent();
        DependencyGraph graph = new DependencyGraph(sheet);

        graph.removeDependencies(address, oldContent.getTerms());
        cell.setContent(newContent);
        graph.addDependencies(address, newContent.getTerms());

        List<CellAddress> order;
        try {
            order = graph.transitiveDependents(address);
        } catch (CircularReferenceException ex) {
            graph.removeDependencies(address, newContent.getTerms());
            graph.addDependencies(address, oldContent.getTerms());
            cell.setContent(oldContent);
            logger.warn("Rejected {} = {}: {}", address, raw, ex.getMessage());
            throw ex;
        }

        CellValueLookup lookup = ref -> sheet.getCell(ref).getValue();
        cell.setValue(computeValue(newContent, lookup));
        logger.debug("Set {} = {} -> {}", address, raw, cell.getValue());

        for (CellAddress dependent : order) {
            Cell dependentCell = sheet.getCell(dependent);
            dependentCell.setValue(computeValue(dependentCell.getContent(), lookup));
        }
        if (!order.isEmpty()) {
            logger.debug("Recomputed dependents of {} in order {}", address, order);
        }
        return new RecalculationResult(address, cell.getValue(), order);
    }

    /**
     * Returns the stored value of a cell.
     * Throws InvalidCellIdException for a malformed id, CellOutOfBoundsException outside the sheet.
     */
    public int getCellValue(Sheet sheet, String cellId) {
        return sheet.getCell(CellAddress.parse(cellId)).getValue();
    }

    public CellSnapshot describeCell(Sheet sheet, String cellId) {
        Cell cell = sheet.getCell(CellAddress.parse(cellId));
        CellContent content = cell.getContent();
        List<String> dependents = cell.getDependents().stream()
                .sorted()
                .map(CellAddress::toString)
                .collect(Collectors.toList());
        return new CellSnapshot(cell.getAddress().toString(), cell.getValue(),
                content.isFormula() ? content.getFormulaText() : null, dependents);
    }

    private CellContent toContent(Sheet sheet, String raw) {
        Integer literal = parseLiteral(raw);
        if (literal != null) {
            return CellContent.literal(literal);
        }
        List<Term> terms = parser.parse(raw);
        // Fails with CellOutOfBoundsException before anything is mutated
        for (CellAddress referenced : DependencyGraph.precedents(terms)) {
            sheet.getCell(referenced);
        }
        return CellContent.formula(raw, terms);
    }

    private int computeValue(CellContent content, CellValueLookup lookup) {
        if (!content.isFormula()) {
            return content.getLiteral();
        }
        return evaluator.evaluate(content.getTerms(), lookup);
    }

    private static Integer parseLiteral(String raw) {
        int start = (raw.charAt(0) == '-' || raw.charAt(0) == '+') ? 1 : 0;
        if (start == raw.length()) {
            return null;
        }
        for (int i = start; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
