package com.raditha.condcov.coverage;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutedLinesTest {

    @Test
    void testMembership() {
        ExecutedLines lines = ExecutedLines.of(1, 5, 5, 9);

        assertTrue(lines.contains(5));
        assertFalse(lines.contains(2));
        assertEquals(3, lines.size());
    }

    @Test
    void testPlusLeavesOriginalUnchanged() {
        ExecutedLines original = ExecutedLines.of(List.of(2, 3));
        ExecutedLines grown = original.plus(7);

        assertFalse(original.contains(7));
        assertTrue(grown.contains(7));
        assertEquals(Set.of(2, 3, 7), grown.asSet());
    }

    @Test
    void testEquality() {
        assertEquals(ExecutedLines.of(4, 2), ExecutedLines.of(List.of(2, 4)));
        assertEquals(ExecutedLines.none(), ExecutedLines.of());
        assertThrows(UnsupportedOperationException.class, () -> ExecutedLines.of(1).asSet().add(2));
    }
}
