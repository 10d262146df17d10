package com.formulagrid.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns exceptions escaping the controllers into error JSON.
 * Formula problems never get here: they are recorded on the cell itself.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCellIdException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCellId(InvalidCellIdException ex) {
        return new ResponseEntity<>(ErrorResponse.invalidCellId(ex), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        LOG.error("Unhandled failure", ex);
        return new ResponseEntity<>(ErrorResponse.serverError(ex), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
