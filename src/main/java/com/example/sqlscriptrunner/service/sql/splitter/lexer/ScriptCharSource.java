package com.example.sqlscriptrunner.service.sql.splitter.lexer;

import lombok.NonNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Nguồn ký tự của script với lookahead có giới hạn.
 * Các ký tự đã peek được giữ trong một ring buffer cố định kích thước {@code capacity},
 * nên bộ nhớ phụ không phụ thuộc độ dài script.
 */
public final class ScriptCharSource {
    public static final int MIN_CAPACITY = 2;

    private final Reader reader;
    private final char[] window;
    private int head;
    private int size;
    private boolean eof;

    public ScriptCharSource(@NonNull Reader reader, int capacity) {
        if (capacity < MIN_CAPACITY) {
            throw new IllegalArgumentException("lookahead capacity must be at least " + MIN_CAPACITY + ": " + capacity);
        }
        this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
        this.window = new char[capacity];
    }

    public int capacity() {
        return window.length;
    }

    /** Ký tự kế tiếp, hoặc -1 khi hết input. */
    public int read() throws IOException {
        if (size == 0 && !fill(1)) {
            return -1;
        }
        char c = window[head];
        head = (head + 1) % window.length;
        size--;
        return c;
    }

    /**
     * Tối đa {@code n} ký tự sắp tới, không consume. Ít hơn {@code n} nếu input sắp hết.
     */
    public String peek(int n) throws IOException {
        if (n < 0 || n > window.length) {
            throw new IllegalArgumentException("peek length " + n + " outside lookahead window of " + window.length);
        }
        fill(n);
        int count = Math.min(n, size);
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(window[(head + i) % window.length]);
        }
        return sb.toString();
    }

    public boolean nextIs(char expected) throws IOException {
        return fill(1) && window[head] == expected;
    }

    private boolean fill(int n) throws IOException {
        while (size < n && !eof) {
            int c = reader.read();
            if (c < 0) {
                eof = true;
                break;
            }
            window[(head + size) % window.length] = (char) c;
            size++;
        }
        return size >= n;
    }
}
