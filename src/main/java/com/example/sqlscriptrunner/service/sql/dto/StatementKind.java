package com.example.sqlscriptrunner.service.sql.dto;

import java.util.Locale;

public enum StatementKind {
    /** Trả về result set: SELECT ... / WITH ... */
    QUERY("query"),
    /** Chạy lấy hiệu ứng: DML, DDL, ... */
    EXECUTION("execution");

    private final String label;

    StatementKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StatementKind of(String statement) {
        if (statement == null) return EXECUTION;
        String normalized = statement.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("select") || normalized.startsWith("with")) {
            return QUERY;
        }
        return EXECUTION;
    }
}
