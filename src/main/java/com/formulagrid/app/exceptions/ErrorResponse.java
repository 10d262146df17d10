package com.formulagrid.app.exceptions;

/**
 * Body of every non-2xx answer from the grid API, e.g.
 * {"code": "INVALID_CELL_ID", "message": "Invalid cell id: K3"}.
 * Broken formulas are not errors at this level; they come back as a normal cell.
 */
public class ErrorResponse {

    public static final String INVALID_CELL_ID = "INVALID_CELL_ID";
    public static final String SERVER_ERROR = "SERVER_ERROR";

    private final String code;
    private final String message;

    private ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorResponse invalidCellId(InvalidCellIdException ex) {
        return new ErrorResponse(INVALID_CELL_ID, ex.getMessage());
    }

    public static ErrorResponse serverError(RuntimeException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return new ErrorResponse(SERVER_ERROR, message);
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
