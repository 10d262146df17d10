package com.formulagrid.app.models;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The whole 10x10 grid:
 * - every cell, created empty up front and never removed
 * - the dependency graph between them
 * - a read/write lock so one edit runs at a time while reads stay consistent
 */
public class Grid {

    // Row-major, same order as CellId.all()
    private final Map<CellId, Cell> cells = new LinkedHashMap<>();

    private final DependencyGraph dependencies = new DependencyGraph();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Grid() {
        for (CellId id : CellId.all()) {
            cells.put(id, new Cell(id));
        }
    }

    public Cell getCell(CellId id) {
        return cells.get(id);
    }

    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public DependencyGraph getDependencies() {
        return dependencies;
    }

    /**
     * Back to the freshly constructed state: all cells empty, no edges.
     */
    public void clear() {
        cells.values().forEach(Cell::clear);
        dependencies.clear();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
