package com.formulagrid.app.models;

/**
 * Represents a single grid cell as held in the cell table.
 * Stores:
 * - rawInput (exactly what the caller last typed)
 * - formula (same text as rawInput; a formula when it starts with "=")
 * - displayValue (literal, computed number, "#ERROR" or "#CIRCULAR")
 * - errorState (reason text, set only alongside a sentinel display value)
 */
public class Cell {

    public static final String ERROR = "#ERROR";
    public static final String CIRCULAR = "#CIRCULAR";

    private final CellId id;
    private String rawInput = "";
    private String formula = "";
    private String displayValue = "";
    private String errorState;

    public Cell(CellId id) {
        this.id = id;
    }

    public CellId getId() {
        return id;
    }

    public String getRawInput() {
        return rawInput;
    }

    public String getFormula() {
        return formula;
    }

    public String getDisplayValue() {
        return displayValue;
    }

    public String getErrorState() {
        return errorState;
    }

    public boolean isEmpty() {
        return rawInput.isEmpty();
    }

    /**
     * Records a new raw input. The formula follows the raw input;
     * the computed fields are left for {@link #applyResult}.
     */
    public void setRawInput(String rawInput) {
        this.rawInput = rawInput;
        this.formula = rawInput;
    }

    public void applyResult(EvaluationResult result) {
        this.displayValue = result.getDisplayValue();
        this.errorState = result.getErrorState();
    }

    public void clear() {
        rawInput = "";
        formula = "";
        displayValue = "";
        errorState = null;
    }

    public CellView toView() {
        return new CellView(id, rawInput, displayValue, errorState);
    }
}
