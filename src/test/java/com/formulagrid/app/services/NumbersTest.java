package com.formulagrid.app.services;

import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class NumbersTest {

    @Test
    void testFormat() {
        assertEquals("8", Numbers.format(8.0));
        assertEquals("2.5", Numbers.format(2.5));
        assertEquals("-3", Numbers.format(-3.0));
        assertEquals("0", Numbers.format(-0.0));
        assertEquals("0.30000000000000004", Numbers.format(0.1 + 0.2));
        assertEquals("1000000000000000000000", Numbers.format(1e21));
        assertEquals("0.0000001", Numbers.format(1e-7));
    }

    @Test
    void testParse() {
        assertEquals(OptionalDouble.of(5), Numbers.parse("5"));
        assertEquals(OptionalDouble.of(-2.5), Numbers.parse(" -2.5 "));
        assertEquals(OptionalDouble.of(1000), Numbers.parse("1e3"));
        assertEquals(OptionalDouble.of(0.5), Numbers.parse(".5"));
    }

    @Test
    void testParseRejectsNonNumbers() {
        assertTrue(Numbers.parse("").isEmpty());
        assertTrue(Numbers.parse("hello").isEmpty());
        assertTrue(Numbers.parse("12abc").isEmpty());
        assertTrue(Numbers.parse("NaN").isEmpty());
        assertTrue(Numbers.parse("Infinity").isEmpty());
        assertTrue(Numbers.parse("1d").isEmpty());
        assertTrue(Numbers.parse("1e999").isEmpty());
        assertTrue(Numbers.parse(null).isEmpty());
    }
}
