package com.formulagrid.app.exceptions;

/**
 * Base type for every failure that can happen while compiling or evaluating
 * a single cell's formula. The message is the reason text shown next to the
 * cell's "#ERROR" sentinel, so it should read well on its own.
 */
public abstract class FormulaException extends RuntimeException {
    protected FormulaException(String message) {
        super(message);
    }

    protected FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
