package com.formulagrid.app.models;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reference edges between cells, kept twice:
 * - forward: precedent -> set of cells whose formulas read it
 * - reverse: dependent -> set of cells its formula reads
 * The forward side answers "what must be recalculated?", the reverse side
 * lets a cell drop its own edges without scanning the whole graph.
 * Not thread-safe; {@link Grid} guards it with its lock.
 */
public class DependencyGraph {

    private final Map<CellId, Set<CellId>> dependentsByPrecedent = new TreeMap<>();
    private final Map<CellId, Set<CellId>> precedentsByDependent = new TreeMap<>();

    /**
     * Records that 'dependent' reads 'precedent'. Adding an existing edge is a no-op.
     */
    public void addDependency(CellId dependent, CellId precedent) {
        dependentsByPrecedent
                .computeIfAbsent(precedent, k -> new TreeSet<>())
                .add(dependent);
        precedentsByDependent
                .computeIfAbsent(dependent, k -> new TreeSet<>())
                .add(precedent);
    }

    /**
     * Removes every edge where 'dependent' is the reading side, and
     * also removes 'dependent' from each precedent's forward set.
     */
    public void removeAllPrecedents(CellId dependent) {
        Set<CellId> oldPrecedents = precedentsByDependent.remove(dependent);
        if (oldPrecedents == null) {
            return;
        }
        for (CellId precedent : oldPrecedents) {
            Set<CellId> dependents = dependentsByPrecedent.get(precedent);
            if (dependents != null) {
                dependents.remove(dependent);
                if (dependents.isEmpty()) {
                    dependentsByPrecedent.remove(precedent);
                }
            }
        }
    }

    public Set<CellId> getDirectDependents(CellId precedent) {
        return copyOf(dependentsByPrecedent.get(precedent));
    }

    public Set<CellId> getPrecedents(CellId dependent) {
        return copyOf(precedentsByDependent.get(dependent));
    }

    /**
     * Transitive closure of the forward edges, in breadth-first discovery order.
     * The start cell shows up only if it lies on a cycle through itself.
     */
    public Set<CellId> getAllDependents(CellId precedent) {
        Set<CellId> result = new LinkedHashSet<>();
        Queue<CellId> queue = new ArrayDeque<>();
        queue.add(precedent);

        while (!queue.isEmpty()) {
            CellId current = queue.poll();
            for (CellId child : dependentsByPrecedent.getOrDefault(current, Collections.emptySet())) {
                if (result.add(child)) {
                    queue.add(child);
                }
            }
        }
        return result;
    }

    /**
     * Walks precedent edges depth-first from 'cell' and reports whether any
     * path leads back to 'cell' itself. A cell that only reads from some other
     * cycle is not on a cycle. Cells stay marked only while they are on the
     * current path; fully explored cells are not walked twice.
     */
    public boolean hasCycleThrough(CellId cell) {
        Set<CellId> onPath = new HashSet<>();
        Set<CellId> explored = new HashSet<>();
        onPath.add(cell);
        for (CellId precedent : precedentsByDependent.getOrDefault(cell, Collections.emptySet())) {
            if (leadsBackTo(cell, precedent, onPath, explored)) {
                return true;
            }
        }
        return false;
    }

    private boolean leadsBackTo(CellId root, CellId cell, Set<CellId> onPath, Set<CellId> explored) {
        if (cell.equals(root)) {
            return true;
        }
        // Already on the path: a cycle that does not include root
        if (onPath.contains(cell) || explored.contains(cell)) {
            return false;
        }
        onPath.add(cell);
        for (CellId precedent : precedentsByDependent.getOrDefault(cell, Collections.emptySet())) {
            if (leadsBackTo(root, precedent, onPath, explored)) {
                return true;
            }
        }
        onPath.remove(cell);
        explored.add(cell);
        return false;
    }

    public void clear() {
        dependentsByPrecedent.clear();
        precedentsByDependent.clear();
    }

    public boolean isEmpty() {
        return precedentsByDependent.isEmpty();
    }

    /** precedent -> dependents, sorted and detached from the live graph. */
    public SortedMap<CellId, Set<CellId>> forwardSnapshot() {
        return snapshot(dependentsByPrecedent);
    }

    /** dependent -> precedents, sorted and detached from the live graph. */
    public SortedMap<CellId, Set<CellId>> reverseSnapshot() {
        return snapshot(precedentsByDependent);
    }

    private static SortedMap<CellId, Set<CellId>> snapshot(Map<CellId, Set<CellId>> edges) {
        SortedMap<CellId, Set<CellId>> copy = new TreeMap<>();
        edges.forEach((key, value) -> copy.put(key, copyOf(value)));
        return Collections.unmodifiableSortedMap(copy);
    }

    private static Set<CellId> copyOf(Set<CellId> cells) {
        if (cells == null || cells.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new TreeSet<>(cells));
    }
}
