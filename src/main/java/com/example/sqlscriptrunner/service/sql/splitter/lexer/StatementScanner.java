package com.example.sqlscriptrunner.service.sql.splitter.lexer;

import lombok.NonNull;

import java.io.IOException;
import java.util.List;

/**
 * State machine quét script từng ký tự một, trái sang phải, một lượt duy nhất.
 * Chỉ dấu ';' gặp ở trạng thái NORMAL mới là ranh giới statement; comment, string,
 * quoted identifier và dollar-quoted body đều "treo" việc tách câu cho tới khi đóng.
 * Hết input khi đang ở trạng thái treo không phải lỗi: phần còn lại thành statement cuối.
 *
 * <p>Mỗi instance chỉ dùng cho một lần quét.</p>
 */
public final class StatementScanner {
    private final ScriptCharSource source;
    private final StatementAccumulator accumulator = new StatementAccumulator();
    private LexerState state = LexerState.NORMAL;

    public StatementScanner(@NonNull ScriptCharSource source) {
        this.source = source;
    }

    public List<String> scan() throws IOException {
        int ch;
        while ((ch = source.read()) != -1) {
            step((char) ch);
        }
        return accumulator.finish();
    }

    public LexerState state() {
        return state;
    }

    private void step(char c) throws IOException {
        switch (state.kind()) {
            case NORMAL -> scanNormal(c);
            case LINE_COMMENT -> {
                accumulator.append(c);
                if (c == '\n') state = LexerState.NORMAL;
            }
            case BLOCK_COMMENT -> {
                accumulator.append(c);
                if (c == '*' && source.nextIs('/')) {
                    consume(1);
                    state = LexerState.NORMAL;
                }
            }
            case SINGLE_QUOTED -> {
                accumulator.append(c);
                if (c == '\'') state = LexerState.NORMAL;
            }
            case DOUBLE_QUOTED -> {
                accumulator.append(c);
                if (c == '"') state = LexerState.NORMAL;
            }
            case DOLLAR_QUOTED -> scanDollarBody(c);
        }
    }

    private void scanNormal(char c) throws IOException {
        if (c == '-' && source.nextIs('-')) {
            accumulator.append(c);
            consume(1);
            state = LexerState.LINE_COMMENT;
        } else if (c == '/' && source.nextIs('*')) {
            accumulator.append(c);
            consume(1);
            state = LexerState.BLOCK_COMMENT;
        } else if (c == '$') {
            accumulator.append(c);
            String tag = detectDollarTag();
            if (tag != null) {
                consume(tag.length() - 1);
                state = LexerState.dollarQuoted(tag);
            }
        } else if (c == '\'') {
            accumulator.append(c);
            state = LexerState.SINGLE_QUOTED;
        } else if (c == '"') {
            accumulator.append(c);
            state = LexerState.DOUBLE_QUOTED;
        } else if (c == ';') {
            accumulator.flush();
        } else {
            accumulator.append(c);
        }
    }

    /**
     * Dò tag mở ngay sau '$' vừa đọc: "$$" hoặc "$word$". Trả về null nếu gặp
     * khoảng trắng trước '$' thứ hai hoặc hết cửa sổ lookahead.
     */
    private String detectDollarTag() throws IOException {
        String ahead = source.peek(source.capacity());
        for (int i = 0; i < ahead.length(); i++) {
            char r = ahead.charAt(i);
            if (r == '$') {
                return "$" + ahead.substring(0, i + 1);
            }
            if (r == ' ' || r == '\t' || r == '\n') {
                return null;
            }
        }
        return null;
    }

    private void scanDollarBody(char c) throws IOException {
        accumulator.append(c);
        if (c != '$') return;

        // phần còn lại của tag, gồm cả '$' đóng
        String rest = state.dollarTag().substring(1);
        if (source.peek(rest.length()).equals(rest)) {
            consume(rest.length());
            state = LexerState.NORMAL;
        }
    }

    private void consume(int n) throws IOException {
        for (int i = 0; i < n; i++) {
            int r = source.read();
            if (r < 0) return;
            accumulator.append((char) r);
        }
    }
}
