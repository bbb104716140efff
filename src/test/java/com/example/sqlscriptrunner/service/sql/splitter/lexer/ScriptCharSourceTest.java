package com.example.sqlscriptrunner.service.sql.splitter.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScriptCharSource lookahead")
class ScriptCharSourceTest {

    private static ScriptCharSource source(String text, int capacity) {
        return new ScriptCharSource(new StringReader(text), capacity);
    }

    @Test
    @DisplayName("peek does not consume")
    void peekDoesNotConsume() throws IOException {
        ScriptCharSource src = source("abc", 4);

        assertEquals("ab", src.peek(2));
        assertEquals("ab", src.peek(2));
        assertEquals('a', src.read());
        assertEquals("bc", src.peek(4));
        assertEquals('b', src.read());
        assertEquals('c', src.read());
        assertEquals(-1, src.read());
        assertEquals("", src.peek(3));
    }

    @Test
    @DisplayName("nextIs looks at the upcoming char only")
    void nextIs() throws IOException {
        ScriptCharSource src = source("-x", 2);

        assertTrue(src.nextIs('-'));
        assertFalse(src.nextIs('x'));
        src.read();
        assertTrue(src.nextIs('x'));
        src.read();
        assertFalse(src.nextIs('x'));
    }

    @Test
    @DisplayName("ring buffer wraps around over long input")
    void wrapsAround() throws IOException {
        String text = "0123456789abcdefghij";
        ScriptCharSource src = source(text, 3);
        StringBuilder seen = new StringBuilder();

        for (int i = 0; i < text.length(); i++) {
            String ahead = src.peek(3);
            assertEquals(text.substring(i, Math.min(text.length(), i + 3)), ahead);
            seen.append((char) src.read());
        }

        assertEquals(text, seen.toString());
        assertEquals(-1, src.read());
    }

    @Test
    @DisplayName("peek beyond the window is rejected")
    void peekBeyondWindow() {
        ScriptCharSource src = source("abcdef", 4);

        assertThrows(IllegalArgumentException.class, () -> src.peek(5));
        assertThrows(IllegalArgumentException.class, () -> src.peek(-1));
    }

    @Test
    @DisplayName("capacity below two is rejected")
    void minimumCapacity() {
        assertThrows(IllegalArgumentException.class, () -> source("a", 1));
        assertEquals(2, source("a", 2).capacity());
    }
}
