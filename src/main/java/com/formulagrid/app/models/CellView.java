package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Read-only snapshot of a cell handed to callers of the engine.
 * errorState is left out of the JSON when the cell is healthy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CellView {
    private final CellId id;
    private final String rawInput;
    private final String displayValue;
    private final String errorState;

    public CellView(CellId id, String rawInput, String displayValue, String errorState) {
        this.id = id;
        this.rawInput = rawInput;
        this.displayValue = displayValue;
        this.errorState = errorState;
    }

    public CellId getId() {
        return id;
    }

    public String getRawInput() {
        return rawInput;
    }

    public String getDisplayValue() {
        return displayValue;
    }

    public String getErrorState() {
        return errorState;
    }

    public boolean hasError() {
        return errorState != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellView)) {
            return false;
        }
        CellView other = (CellView) o;
        return id.equals(other.id)
                && rawInput.equals(other.rawInput)
                && displayValue.equals(other.displayValue)
                && Objects.equals(errorState, other.errorState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, rawInput, displayValue, errorState);
    }

    @Override
    public String toString() {
        return id + "{raw='" + rawInput + "', display='" + displayValue + "'"
                + (errorState != null ? ", error='" + errorState + "'" : "") + "}";
    }
}
