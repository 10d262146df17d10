package com.formulagrid.app.exceptions;

/**
 * Thrown when a formula references a cell that has no numeric value:
 * the cell is empty, holds text, or is itself in an error or circular state.
 */
public class InvalidReferenceException extends FormulaException {
    private final String reference;

    public InvalidReferenceException(String reference) {
        super("Invalid reference: " + reference);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
