package com.example.sqlscriptrunner.service.connection;

import java.util.Locale;
import java.util.Optional;

public enum DatabaseEngine {
    ORACLE("oracle", 1521),
    SQLSERVER("sqlserver", 1433),
    POSTGRES("postgres", 5432);

    private final String cliName;
    private final int defaultPort;

    DatabaseEngine(String cliName, int defaultPort) {
        this.cliName = cliName;
        this.defaultPort = defaultPort;
    }

    public String cliName() {
        return cliName;
    }

    public int defaultPort() {
        return defaultPort;
    }

    public String jdbcUrl(String host, int port, String dbname) {
        return switch (this) {
            case ORACLE -> String.format("jdbc:oracle:thin:@%s:%d/%s", host, port, dbname);
            case SQLSERVER -> String.format("jdbc:sqlserver://%s:%d;databaseName=%s", host, port, dbname);
            case POSTGRES -> String.format("jdbc:postgresql://%s:%d/%s", host, port, dbname);
        };
    }

    /** Tên engine trên command line, không phân biệt hoa/thường. */
    public static Optional<DatabaseEngine> fromName(String name) {
        if (name == null) return Optional.empty();
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "oracle" -> Optional.of(ORACLE);
            case "sqlserver" -> Optional.of(SQLSERVER);
            case "postgres" -> Optional.of(POSTGRES);
            default -> Optional.empty();
        };
    }
}
