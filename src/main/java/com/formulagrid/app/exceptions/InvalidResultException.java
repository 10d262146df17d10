package com.formulagrid.app.exceptions;

/**
 * Thrown when an expression cannot produce a usable number:
 * division by zero, mismatched parentheses, a missing operand, etc.
 */
public class InvalidResultException extends FormulaException {
    public InvalidResultException() {
        super("Invalid result");
    }

    public InvalidResultException(Throwable cause) {
        super("Invalid result", cause);
    }
}
