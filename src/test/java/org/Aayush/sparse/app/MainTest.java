package org.Aayush.sparse.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testMainOutputsExpectedLines() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer));
            Main.main(new String[0]);
        } finally {
            System.setOut(originalOut);
        }

        List<String> lines = Arrays.asList(buffer.toString().split("\\R"));
        assertEquals(8 + 1 + 18, lines.size());
        assertEquals("1 0 0 0 0 0 0 8", lines.get(0));
        assertEquals("0 0 0 4 5 0 0 0", lines.get(3));
        assertEquals("18", lines.get(8));
        assertTrue(lines.contains("1 1 1"));
        assertTrue(lines.contains("0 9 9"));
        assertTrue(lines.contains("9 9 9"));
        assertFalse(lines.contains("0 0 0"));
        assertFalse(lines.contains("9 0 0"));
    }
}
