package com.formulagrid.app.services;

import com.formulagrid.app.models.CellId;

import java.util.OptionalDouble;

/**
 * Looks up the current numeric value of a referenced cell while a formula
 * is compiled. Empty when the cell has nothing a formula can compute with.
 */
@FunctionalInterface
public interface CellValueResolver {
    OptionalDouble resolve(CellId reference);
}
