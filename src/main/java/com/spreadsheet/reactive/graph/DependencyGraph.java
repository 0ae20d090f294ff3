package com.spreadsheet.reactive.graph;

import com.spreadsheet.reactive.exceptions.CircularReferenceException;
import com.spreadsheet.reactive.formula.Term;
import com.spreadsheet.reactive.models.CellAddress;
import com.spreadsheet.reactive.models.Sheet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency edges of a sheet, stored as each cell's dependents set:
 * "referenced cell" -> set of cells whose formula references it.
 * <p>
 * The edges are always derived from formula terms, so callers add them for a newly
 * installed formula and remove them with the terms of the formula being replaced.
 */
public class DependencyGraph {

    private enum Mark {
        IN_PROGRESS,
        DONE
    }

    private final Sheet sheet;

    public DependencyGraph(Sheet sheet) {
        this.sheet = sheet;
    }

    /**
     * Adds 'owner' to the dependents of every cell referenced by 'terms'.
     */
    public void addDependencies(CellAddress owner, List<Term> terms) {
        for (CellAddress referenced : precedents(terms)) {
            sheet.getCell(referenced).addDependent(owner);
        }
    }

    /**
     * Removes 'owner' from the dependents of every cell referenced by 'terms'.
     * Must be given the terms of the formula 'owner' held until now.
     */
    public void removeDependencies(CellAddress owner, List<Term> terms) {
        for (CellAddress referenced : precedents(terms)) {
            sheet.getCell(referenced).removeDependent(owner);
        }
    }

    public Set<CellAddress> directDependents(CellAddress address) {
        return sheet.getCell(address).getDependents();
    }

    /**
     * Distinct cells referenced by the given terms, in first-seen order.
     */
    public static Set<CellAddress> precedents(List<Term> terms) {
        Set<CellAddress> referenced = new LinkedHashSet<>();
        for (Term term : terms) {
            if (term.isReference()) {
                referenced.add(term.getReference());
            }
        }
        return referenced;
    }

    /**
     * Every cell reachable from 'start' through dependents edges, each once,
     * ordered so a cell comes after all the cells it reads from within the result.
     * 'start' itself is not part of the result.
     * <p>
     * Depth-first with in-progress/done marks; reaching a cell that is still in progress
     * means the edges form a loop, reported as CircularReferenceException.
     */
    public List<CellAddress> transitiveDependents(CellAddress start) {
        Map<CellAddress, Mark> marks = new HashMap<>();
        List<CellAddress> finished = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        marks.put(start, Mark.IN_PROGRESS);
        stack.push(new Frame(start, directDependents(start).iterator()));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.pending.hasNext()) {
                CellAddress next = frame.pending.next();
                Mark mark = marks.get(next);
                if (mark == Mark.IN_PROGRESS) {
                    throw new CircularReferenceException(
                            "Cycle detected at " + next + " while following dependents of " + start);
                }
                if (mark == null) {
                    marks.put(next, Mark.IN_PROGRESS);
                    stack.push(new Frame(next, directDependents(next).iterator()));
                }
            } else {
                stack.pop();
                marks.put(frame.address, Mark.DONE);
                if (!frame.address.equals(start)) {
                    finished.add(frame.address);
                }
            }
        }

        // Post-order lists each cell after its dependents; reversed it is a topological order
        Collections.reverse(finished);
        return finished;
    }

    private static final class Frame {
        private final CellAddress address;
        private final Iterator<CellAddress> pending;

        private Frame(CellAddress address, Iterator<CellAddress> pending) {
            this.address = address;
            this.pending = pending;
        }
    }
}
