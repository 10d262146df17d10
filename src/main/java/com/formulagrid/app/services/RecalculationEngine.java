package com.formulagrid.app.services;

import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.CellId;
import com.formulagrid.app.models.CellView;
import com.formulagrid.app.models.DependencyGraph;
import com.formulagrid.app.models.EvaluationResult;
import com.formulagrid.app.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Main business logic: applying an edit to a cell, keeping the dependency
 * graph in step with the formulas, detecting cycles, and recalculating
 * every cell downstream of the edit.
 */
@Service
public class RecalculationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecalculationEngine.class);

    private final Grid grid;
    private final FormulaCompiler compiler;

    public RecalculationEngine() {
        this(new Grid(), new FormulaCompiler());
    }

    public RecalculationEngine(Grid grid, FormulaCompiler compiler) {
        this.grid = grid;
        this.compiler = compiler;
    }

    public void applyEdit(String cellId, String rawInput) {
        applyEdit(CellId.parse(cellId), rawInput);
    }

    /**
     * Sets a cell's raw input with these steps:
     * 1) Store the input; a null input counts as clearing the cell.
     * 2) Recalculate the cell: drop its old edges, compile, add new edges, check for cycles.
     * 3) Recalculate each transitive dependent once, precedents before dependents.
     * Never throws for bad formulas; failures end up in the cells' error state.
     */
    public void applyEdit(CellId cellId, String rawInput) {
        String input = rawInput == null ? "" : rawInput;

        grid.getLock().writeLock().lock();
        try {
            LOG.debug("Edit {} <- '{}'", cellId, input);
            Cell cell = grid.getCell(cellId);
            cell.setRawInput(input);
            recalculate(cell);
            propagate(cellId);
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    public CellView getCell(String cellId) {
        return getCell(CellId.parse(cellId));
    }

    public CellView getCell(CellId cellId) {
        grid.getLock().readLock().lock();
        try {
            return grid.getCell(cellId).toView();
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * Snapshot of all 100 cells, row-major.
     */
    public Map<CellId, CellView> getAllCells() {
        grid.getLock().readLock().lock();
        try {
            Map<CellId, CellView> views = new LinkedHashMap<>();
            for (Cell cell : grid.getCells()) {
                views.put(cell.getId(), cell.toView());
            }
            return Collections.unmodifiableMap(views);
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * Returns a map of cellId -> displayValue for every cell that has input.
     */
    public Map<String, String> getAllCellValues() {
        grid.getLock().readLock().lock();
        try {
            Map<String, String> data = new LinkedHashMap<>();
            for (Cell cell : grid.getCells()) {
                if (!cell.isEmpty()) {
                    data.put(cell.getId().toString(), cell.getDisplayValue());
                }
            }
            return data;
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    public Set<CellId> getPrecedents(CellId cellId) {
        grid.getLock().readLock().lock();
        try {
            return grid.getDependencies().getPrecedents(cellId);
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    public Set<CellId> getDependents(CellId cellId) {
        grid.getLock().readLock().lock();
        try {
            return grid.getDependencies().getDirectDependents(cellId);
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    public SortedMap<CellId, Set<CellId>> getForwardDependencies() {
        grid.getLock().readLock().lock();
        try {
            return grid.getDependencies().forwardSnapshot();
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    public SortedMap<CellId, Set<CellId>> getReverseDependencies() {
        grid.getLock().readLock().lock();
        try {
            return grid.getDependencies().reverseSnapshot();
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * Empties every cell and forgets all dependencies.
     */
    public void reset() {
        grid.getLock().writeLock().lock();
        try {
            grid.clear();
            LOG.info("Grid reset");
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    /**
     * Re-derives one cell from its current formula. Its edges are rebuilt from
     * the formula text every time, and a cycle wins over whatever the compiler said.
     */
    private void recalculate(Cell cell) {
        CellId cellId = cell.getId();
        DependencyGraph graph = grid.getDependencies();

        graph.removeAllPrecedents(cellId);
        EvaluationResult result = compiler.compile(cell.getFormula(), this::resolve);
        for (CellId reference : result.getReferences()) {
            graph.addDependency(cellId, reference);
        }

        if (graph.hasCycleThrough(cellId)) {
            LOG.debug("Circular reference at {}", cellId);
            result = EvaluationResult.circular(result.getReferences());
        }

        cell.applyResult(result);
        LOG.debug("Recalculated {} -> '{}'{}", cellId, result.getDisplayValue(),
                result.isError() ? " (" + result.getErrorState() + ")" : "");
    }

    private OptionalDouble resolve(CellId reference) {
        String display = grid.getCell(reference).getDisplayValue();
        if (Cell.ERROR.equals(display) || Cell.CIRCULAR.equals(display)) {
            return OptionalDouble.empty();
        }
        return Numbers.parse(display);
    }

    /**
     * Recalculates everything downstream of 'origin'. Cells whose affected
     * precedents are all done go first (breadth-first among equals), so each
     * cell reads fresh values. Cells on or behind a cycle never become ready
     * and are handled last, in discovery order.
     */
    private void propagate(CellId origin) {
        DependencyGraph graph = grid.getDependencies();
        Set<CellId> affected = graph.getAllDependents(origin);
        affected.remove(origin);
        if (affected.isEmpty()) {
            return;
        }

        Map<CellId, Integer> pending = new HashMap<>();
        Queue<CellId> ready = new ArrayDeque<>();
        for (CellId cellId : affected) {
            int count = 0;
            for (CellId precedent : graph.getPrecedents(cellId)) {
                if (affected.contains(precedent)) {
                    count++;
                }
            }
            pending.put(cellId, count);
            if (count == 0) {
                ready.add(cellId);
            }
        }

        Set<CellId> processed = new HashSet<>();
        processed.add(origin);

        while (!ready.isEmpty()) {
            CellId current = ready.poll();
            if (!processed.add(current)) {
                continue;
            }
            recalculate(grid.getCell(current));
            for (CellId dependent : graph.getDirectDependents(current)) {
                if (affected.contains(dependent) && pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        for (CellId cellId : affected) {
            if (processed.add(cellId)) {
                recalculate(grid.getCell(cellId));
            }
        }
        LOG.debug("Edit of {} recalculated {} dependent cell(s)", origin, processed.size() - 1);
    }
}
