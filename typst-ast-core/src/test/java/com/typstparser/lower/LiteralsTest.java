package com.typstparser.lower;

import com.typstparser.ast.Unit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LiteralsTest {

    @Test
    void testIntegerBases() {
        assertEquals(42, Literals.intValue("42"));
        assertEquals(31, Literals.intValue("0x1F"));
        assertEquals(15, Literals.intValue("0o17"));
        assertEquals(5, Literals.intValue("0b101"));
    }

    @Test
    void testIntegerOverflowYieldsZero() {
        assertEquals(0, Literals.intValue("99999999999999999999"));
        assertNull(Literals.parseInt("99999999999999999999", 10));
    }

    @Test
    void testFloats() {
        assertEquals(1000.0, Literals.floatValue("1e3"));
        assertEquals(1.5, Literals.floatValue("1.5"));
        assertEquals(0.5, Literals.floatValue(".5"));
        assertNull(Literals.parseFloat("."));
        assertNull(Literals.parseFloat("0x10"));
    }

    @Test
    void testNumericLiterals() {
        assertEquals(Unit.PT, Literals.numericUnit("12.5pt"));
        assertEquals(12.5, Literals.numericValue("12.5pt"));
        assertEquals(Unit.PERCENT, Literals.numericUnit("50%"));
        assertEquals(50.0, Literals.numericValue("50%"));
        assertEquals(Unit.RAD, Literals.numericUnit("2rad"));
        assertEquals(Unit.FR, Literals.numericUnit("1fr"));
        assertNull(Literals.numericUnit("12"));
        assertEquals(Unit.IN, Literals.unitOf("in"));
    }

    @Test
    void testEnumNumbers() {
        assertEquals(3L, Literals.parseEnumNumber("3"));
        assertNull(Literals.parseEnumNumber(""));
    }

    @Test
    void testEscapes() {
        assertEquals("#", Literals.escapeCharacter("\\#"));
        assertEquals(new String(Character.toChars(0x1F600)), Literals.escapeCharacter("\\u{1F600}"));
        assertEquals("\uFFFD", Literals.escapeCharacter("\\u{D800}"), "surrogates are not scalar values");
        assertEquals(-1, Literals.parseCodePoint("110000"));
    }

    @Test
    void testShorthands() {
        assertEquals("\u00A0", Literals.shorthandCharacter("~"));
        assertEquals("\u2013", Literals.shorthandCharacter("--"));
        assertEquals("\u2014", Literals.shorthandCharacter("---"));
        assertEquals("\u2026", Literals.shorthandCharacter("..."));
        assertEquals("\u2192", Literals.mathShorthandCharacter("->"));
        assertEquals("\u2260", Literals.mathShorthandCharacter("!="));
    }

    @Test
    void testStringEscapes() {
        assertEquals("a\nb", Literals.unescapeString("\"a\\nb\""));
        assertEquals("say \"hi\"", Literals.unescapeString("\"say \\\"hi\\\"\""));
        assertEquals("A", Literals.unescapeString("\"\\u{41}\""));
        assertEquals("tab\there", Literals.unescapeString("\"tab\\there\""));
    }
}
