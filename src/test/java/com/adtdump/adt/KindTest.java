package com.adtdump.adt;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class KindTest {

    @Test
    public void testSingleKind() {
        assertEquals("int", Kind.toString(EnumSet.of(Kind.INT)));
        assertEquals("struct", Kind.toString(EnumSet.of(Kind.STRUCT)));
    }

    @Test
    public void testNoKindsIsBottom() {
        assertEquals("_|_", Kind.toString(EnumSet.noneOf(Kind.class)));
    }

    @Test
    public void testAllKindsIsTop() {
        assertEquals("_", Kind.toString(EnumSet.allOf(Kind.class)));
    }

    @Test
    public void testIntAndFloatPrintAsNumberLast() {
        assertEquals("number", Kind.toString(EnumSet.of(Kind.INT, Kind.FLOAT)));
        assertEquals("(null|string|number)", Kind.toString(EnumSet.of(Kind.FLOAT, Kind.STRING, Kind.NULL, Kind.INT)));
    }

    @Test
    public void testSeveralKindsAreParenthesizedInDeclarationOrder() {
        assertEquals("(string|bytes)", Kind.toString(EnumSet.of(Kind.BYTES, Kind.STRING)));
        assertEquals("(bool|float)", Kind.toString(EnumSet.of(Kind.FLOAT, Kind.BOOL)));
    }

    @Test
    public void testParseSetExpandsNumber() {
        Set<Kind> kinds = Kind.parseSet(List.of("number", "string"));
        assertEquals(EnumSet.of(Kind.INT, Kind.FLOAT, Kind.STRING), kinds);
    }

    @Test
    public void testUnknownKindName() {
        assertThrows(IllegalArgumentException.class, () -> Kind.fromText("decimal"));
        assertEquals(Kind.BYTES, Kind.fromText("bytes"));
    }
}
