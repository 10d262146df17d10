package com.formulagrid.app.exceptions;

/**
 * Thrown when a caller addresses a cell outside the grid,
 * i.e. anything not matching A1..J10.
 * For example, "Invalid cell id: K3".
 */
public class InvalidCellIdException extends RuntimeException {
    public InvalidCellIdException(String message) {
        super(message);
    }
}
