package com.formulagrid.app.exceptions;

/**
 * Thrown when a formula, after reference substitution, still contains
 * something other than digits, decimal points, parentheses and the
 * four arithmetic operators (e.g., "=A1+foo").
 */
public class InvalidCharactersException extends FormulaException {
    public InvalidCharactersException() {
        super("Invalid characters in formula");
    }
}
