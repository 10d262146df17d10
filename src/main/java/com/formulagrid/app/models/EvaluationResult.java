package com.formulagrid.app.models;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of compiling one cell's formula: what to display, why it failed
 * (if it did), and which cells the formula references.
 */
public final class EvaluationResult {
    private final String displayValue;
    private final String errorState;
    private final List<CellId> references;

    private EvaluationResult(String displayValue, String errorState, List<CellId> references) {
        this.displayValue = displayValue;
        this.errorState = errorState;
        this.references = Collections.unmodifiableList(references);
    }

    public static EvaluationResult value(String displayValue, List<CellId> references) {
        return new EvaluationResult(displayValue, null, references);
    }

    public static EvaluationResult error(String reason, List<CellId> references) {
        return new EvaluationResult(Cell.ERROR, reason, references);
    }

    public static EvaluationResult circular(List<CellId> references) {
        return new EvaluationResult(Cell.CIRCULAR, "Circular reference detected", references);
    }

    public String getDisplayValue() {
        return displayValue;
    }

    public String getErrorState() {
        return errorState;
    }

    public List<CellId> getReferences() {
        return references;
    }

    public boolean isError() {
        return errorState != null;
    }
}
