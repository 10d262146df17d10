package com.formulagrid.app.models;

import com.formulagrid.app.exceptions.InvalidCellIdException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellIdTest {

    @Test
    void testParseValidIds() {
        CellId a1 = CellId.parse("A1");
        assertEquals('A', a1.getColumn());
        assertEquals(1, a1.getRow());

        CellId j10 = CellId.parse("J10");
        assertEquals('J', j10.getColumn());
        assertEquals(10, j10.getRow());
        assertEquals("J10", j10.toString());
    }

    @Test
    void testParseReturnsSameInstance() {
        assertSame(CellId.parse("C7"), CellId.of('C', 7));
    }

    @Test
    void testParseRejectsOutOfGrid() {
        assertThrows(InvalidCellIdException.class, () -> CellId.parse("K1"));
        assertThrows(InvalidCellIdException.class, () -> CellId.parse("A0"));
        assertThrows(InvalidCellIdException.class, () -> CellId.parse("A11"));
        assertThrows(InvalidCellIdException.class, () -> CellId.parse("a1"));
        assertThrows(InvalidCellIdException.class, () -> CellId.parse(" A1"));
        assertThrows(InvalidCellIdException.class, () -> CellId.parse(""));
        assertThrows(InvalidCellIdException.class, () -> CellId.parse(null));
    }

    /**
     * 100 ids, row-major: A1..J1 first, J10 last.
     */
    @Test
    void testAllIsRowMajor() {
        List<CellId> all = CellId.all();
        assertEquals(100, all.size());
        assertEquals("A1", all.get(0).toString());
        assertEquals("J1", all.get(9).toString());
        assertEquals("A2", all.get(10).toString());
        assertEquals("J10", all.get(99).toString());
        assertTrue(CellId.parse("J1").compareTo(CellId.parse("A2")) < 0);
    }
}
