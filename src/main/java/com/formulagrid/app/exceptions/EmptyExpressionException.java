package com.formulagrid.app.exceptions;

/**
 * Thrown when nothing is left of a formula once its references
 * have been substituted and its whitespace removed.
 */
public class EmptyExpressionException extends FormulaException {
    public EmptyExpressionException() {
        super("Empty expression after replacements");
    }
}
