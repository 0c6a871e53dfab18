package me.christianrobert.cpp2py.batch.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffRendererTest {

    private final DiffRenderer renderer = new DiffRenderer();

    @Test
    void equalContentHasNoDiff() {
        assertEquals("", renderer.unifiedDiff("a.py", "x = 1\n", "x = 1\n"));
    }

    @Test
    void changedLineIsShownWithHeaders() {
        String diff = renderer.unifiedDiff("a.py", "x = 1\ny = 2\n", "x = 1\ny = 3\n");

        assertTrue(diff.startsWith("--- a/a.py\n+++ b/a.py\n@@ "), diff);
        assertTrue(diff.contains("\n-y = 2\n"), diff);
        assertTrue(diff.contains("\n+y = 3\n"), diff);
        assertTrue(diff.contains("\n x = 1\n"), "Unchanged lines are context: " + diff);
    }

    @Test
    void missingFileDiffsAgainstEmpty() {
        String diff = renderer.unifiedDiff("new.py", "", "print(1)\n");

        assertTrue(diff.contains("+print(1)"), diff);
        assertFalse(diff.contains("\n-print"), diff);
    }
}
