package com.example.sqlscriptrunner.service.sql.splitter.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gom ký tự của statement hiện tại; mỗi lần flush sẽ trim và chỉ giữ statement khác rỗng.
 */
public final class StatementAccumulator {
    private final StringBuilder buffer = new StringBuilder(256);
    private final List<String> statements = new ArrayList<>();

    public void append(char c) {
        buffer.append(c);
    }

    public void append(CharSequence span) {
        buffer.append(span);
    }

    public void flush() {
        String text = buffer.toString().trim();
        if (!text.isEmpty()) {
            statements.add(text);
        }
        buffer.setLength(0);
    }

    public List<String> finish() {
        flush();
        return Collections.unmodifiableList(statements);
    }

    int pendingLength() {
        return buffer.length();
    }
}
