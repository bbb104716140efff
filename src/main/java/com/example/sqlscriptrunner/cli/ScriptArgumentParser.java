package com.example.sqlscriptrunner.cli;

import com.example.sqlscriptrunner.config.ErrorConfig;
import com.example.sqlscriptrunner.config.RunnerConfig;
import com.example.sqlscriptrunner.dto.RunSettings;
import com.example.sqlscriptrunner.exception.AppException;
import com.example.sqlscriptrunner.service.connection.DatabaseEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Đọc tham số dạng {@code -engine postgres -host db -sql a.sql} (cũng nhận {@code --name value}
 * và {@code --name=value}) thành {@link RunSettings}. Gom tất cả lỗi rồi mới ném, trước mọi I/O.
 */
@Component
@RequiredArgsConstructor
public class ScriptArgumentParser {
    public static final Set<String> FLAGS = Set.of("engine", "host", "port", "username", "password", "dbname", "sql");

    private final RunnerConfig config;

    public RunSettings parse(String... args) {
        Map<String, String> params = new HashMap<>();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-")) {
                errors.add("unknown argument: " + arg);
                continue;
            }
            String key = arg.replaceFirst("^-+", "");
            String value;
            int eq = key.indexOf('=');
            if (eq >= 0) {
                value = key.substring(eq + 1);
                key = key.substring(0, eq);
                // --runner.query-timeout=10m,... là property của Spring Environment
                if (arg.startsWith("--") && key.contains(".")) continue;
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                errors.add("missing value for " + arg);
                continue;
            }
            if (!FLAGS.contains(key)) {
                errors.add("unknown flag: " + arg);
                continue;
            }
            params.put(key, value);
        }

        String engineName = params.getOrDefault("engine", "");
        String host = params.getOrDefault("host", "");
        String username = params.getOrDefault("username", config.getDefaultUsername());
        String password = params.getOrDefault("password", "");
        String dbname = params.getOrDefault("dbname", "");
        String sqlPath = params.getOrDefault("sql", "");

        int port = 0;
        if (params.containsKey("port")) {
            try {
                port = Integer.parseInt(params.get("port").trim());
            } catch (NumberFormatException e) {
                errors.add("port must be a number");
            }
        }

        if (engineName.isBlank()) errors.add("engine is required");
        if (host.isBlank()) errors.add("host is required");
        if (dbname.isBlank()) errors.add("dbname is required");
        if (sqlPath.isBlank()) errors.add("sql path is required");

        DatabaseEngine engine = null;
        if (!engineName.isBlank()) {
            engine = DatabaseEngine.fromName(engineName).orElse(null);
            if (engine == null) {
                errors.add("unsupported engine: " + engineName);
            }
        }

        if (!errors.isEmpty()) {
            throw new AppException(ErrorConfig.INVALID_ARGUMENT, String.join(System.lineSeparator(), errors));
        }

        return RunSettings.builder()
                .engine(engine)
                .host(host)
                .port(port == 0 ? engine.defaultPort() : port)
                .username(username)
                .password(password)
                .dbname(dbname)
                .sqlPath(sqlPath)
                .build();
    }
}
