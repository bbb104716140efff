package com.example.sqlscriptrunner.service.sql.splitter.service;

import com.example.sqlscriptrunner.config.RunnerConfig;
import com.example.sqlscriptrunner.exception.ScriptReadException;
import com.example.sqlscriptrunner.service.sql.splitter.implement.SqlSplitterImpl;
import com.example.sqlscriptrunner.service.sql.splitter.lexer.ScriptCharSource;
import com.example.sqlscriptrunner.service.sql.splitter.lexer.StatementScanner;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Splitter cho script SQL.
 * Bean không giữ state: mọi state (lexer, buffer, kết quả) thuộc về một lần gọi split().
 */
@Slf4j
@Service
public class SqlSplitter implements SqlSplitterImpl {
    public static final int DEFAULT_LOOKAHEAD_WINDOW = 64;

    private final int lookaheadWindow;

    public SqlSplitter() {
        this(DEFAULT_LOOKAHEAD_WINDOW);
    }

    public SqlSplitter(int lookaheadWindow) {
        if (lookaheadWindow < ScriptCharSource.MIN_CAPACITY) {
            throw new IllegalArgumentException("lookahead window must be at least "
                    + ScriptCharSource.MIN_CAPACITY + ": " + lookaheadWindow);
        }
        this.lookaheadWindow = lookaheadWindow;
    }

    @Autowired
    public SqlSplitter(RunnerConfig config) {
        this(config.getLookaheadWindow());
    }

    @Override
    public List<String> split(@NonNull String script) {
        try {
            return scan(new StringReader(script));
        } catch (IOException e) {
            // StringReader không ném IOException khi chưa close
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public List<String> split(@NonNull Reader reader) {
        try {
            return scan(reader);
        } catch (IOException e) {
            throw new ScriptReadException("failed to read SQL script: " + e.getMessage(), e);
        }
    }

    private List<String> scan(Reader reader) throws IOException {
        StatementScanner scanner = new StatementScanner(new ScriptCharSource(reader, lookaheadWindow));
        List<String> statements = scanner.scan();
        if (!scanner.state().isNormal()) {
            log.debug("Script ended inside {}; trailing text kept as last statement", scanner.state().kind());
        }
        log.debug("Split script into {} statement(s)", statements.size());
        return statements;
    }
}
