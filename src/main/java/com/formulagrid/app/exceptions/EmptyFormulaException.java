package com.formulagrid.app.exceptions;

/**
 * Thrown when a formula consists of "=" and nothing else
 * (whitespace included).
 */
public class EmptyFormulaException extends FormulaException {
    public EmptyFormulaException() {
        super("Empty formula");
    }
}
