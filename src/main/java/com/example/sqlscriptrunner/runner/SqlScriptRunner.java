package com.example.sqlscriptrunner.runner;

import com.example.sqlscriptrunner.cli.ScriptArgumentParser;
import com.example.sqlscriptrunner.config.ErrorConfig;
import com.example.sqlscriptrunner.dto.RunSettings;
import com.example.sqlscriptrunner.exception.AppException;
import com.example.sqlscriptrunner.exception.GlobalExceptionHandler;
import com.example.sqlscriptrunner.exception.ScriptReadException;
import com.example.sqlscriptrunner.service.connection.implement.DataSourceFactoryImpl;
import com.example.sqlscriptrunner.service.sql.executor.implement.ScriptExecutorImpl;
import com.example.sqlscriptrunner.service.sql.splitter.implement.SqlSplitterImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Một lần chạy: parse tham số -> đọc + tách script -> chạy trong một transaction.
 * Exit code được giữ lại cho {@code SpringApplication.exit(...)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlScriptRunner implements CommandLineRunner, ExitCodeGenerator {
    private final ScriptArgumentParser argumentParser;
    private final SqlSplitterImpl splitter;
    private final DataSourceFactoryImpl dataSourceFactory;
    private final ScriptExecutorImpl executor;
    private final GlobalExceptionHandler exceptionHandler;

    private int exitCode = GlobalExceptionHandler.EXIT_OK;

    @Override
    public void run(String... args) {
        try {
            RunSettings settings = argumentParser.parse(args);
            log.info("Running {}", settings);

            List<String> statements = readStatements(Path.of(settings.getSqlPath()));
            if (statements.isEmpty()) {
                throw new AppException(ErrorConfig.NO_STATEMENTS, "no SQL statements found in file");
            }
            log.info("Found {} statement(s) in {}", statements.size(), settings.getSqlPath());

            DataSource dataSource = dataSourceFactory.create(settings);
            try {
                executor.execute(dataSource, statements);
            } finally {
                close(dataSource);
            }
            exitCode = GlobalExceptionHandler.EXIT_OK;
        } catch (Exception e) {
            exitCode = exceptionHandler.handle(e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private List<String> readStatements(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return splitter.split(reader);
        } catch (ScriptReadException e) {
            throw new ScriptReadException("failed to read SQL file: " + e.getCause().getMessage(), e.getCause());
        } catch (IOException e) {
            throw new ScriptReadException("failed to read SQL file: " + e.getMessage(), e);
        }
    }

    private void close(DataSource dataSource) {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close data source: {}", e.getMessage());
            }
        }
    }
}
