package com.example.sqlscriptrunner.service.sql.executor.util;

import com.example.sqlscriptrunner.service.sql.dto.QueryResultDto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Render kết quả query thành bảng có viền, độ rộng cột cố định:
 * <pre>
 * +----+-------+
 * | id | name  |
 * +----+-------+
 * | 1  | alice |
 * +----+-------+
 * </pre>
 */
public final class ResultTableFormatter {

    private ResultTableFormatter() {}

    public static List<String> format(QueryResultDto result) {
        List<String> headers = result.getColumns() == null ? Collections.emptyList() : result.getColumns();
        List<List<String>> rows = result.getRows() == null ? Collections.emptyList() : result.getRows();

        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < row.size() && i < widths.length; i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        List<String> lines = new ArrayList<>(rows.size() + 4);
        String separator = separator(widths);
        lines.add(separator);
        lines.add(row(headers, widths));
        lines.add(separator);
        for (List<String> row : rows) {
            lines.add(row(row, widths));
        }
        lines.add(separator);
        return lines;
    }

    private static String separator(int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('+');
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String row(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            int padding = widths[i] - cell.length();
            sb.append(' ').append(cell).append(" ".repeat(padding + 1)).append('|');
        }
        return sb.toString();
    }
}
