package com.example.sqlscriptrunner.service.sql.splitter.lexer;

import java.util.Objects;

/**
 * Ngữ cảnh lexer tại một vị trí quét. Chỉ DOLLAR_QUOTED mang theo tag
 * (gồm cả hai dấu '$', ví dụ "$$" hoặc "$body$").
 */
public record LexerState(Kind kind, String dollarTag) {

    public enum Kind {
        NORMAL,
        LINE_COMMENT,
        BLOCK_COMMENT,
        SINGLE_QUOTED,
        DOUBLE_QUOTED,
        DOLLAR_QUOTED
    }

    public static final LexerState NORMAL = new LexerState(Kind.NORMAL, null);
    public static final LexerState LINE_COMMENT = new LexerState(Kind.LINE_COMMENT, null);
    public static final LexerState BLOCK_COMMENT = new LexerState(Kind.BLOCK_COMMENT, null);
    public static final LexerState SINGLE_QUOTED = new LexerState(Kind.SINGLE_QUOTED, null);
    public static final LexerState DOUBLE_QUOTED = new LexerState(Kind.DOUBLE_QUOTED, null);

    public LexerState {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.DOLLAR_QUOTED) {
            if (dollarTag == null || dollarTag.length() < 2
                    || dollarTag.charAt(0) != '$' || dollarTag.charAt(dollarTag.length() - 1) != '$') {
                throw new IllegalArgumentException("invalid dollar tag: " + dollarTag);
            }
        } else if (dollarTag != null) {
            throw new IllegalArgumentException(kind + " does not carry a dollar tag");
        }
    }

    public static LexerState dollarQuoted(String tag) {
        return new LexerState(Kind.DOLLAR_QUOTED, tag);
    }

    /** Trạng thái mà dấu ';' có thể kết thúc statement. */
    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }
}
