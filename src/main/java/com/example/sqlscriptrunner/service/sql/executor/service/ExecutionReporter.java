package com.example.sqlscriptrunner.service.sql.executor.service;

import com.example.sqlscriptrunner.service.sql.dto.QueryResultDto;
import com.example.sqlscriptrunner.service.sql.dto.SqlStatementDto;
import com.example.sqlscriptrunner.service.sql.executor.util.ResultTableFormatter;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * In kết quả từng statement ra stdout ngay khi chạy xong.
 * Log đi stderr (logback-spring.xml) nên không lẫn vào đây.
 */
@Component
public class ExecutionReporter {
    private final PrintStream out;

    public ExecutionReporter() {
        this(System.out);
    }

    public ExecutionReporter(PrintStream out) {
        this.out = out;
    }

    public void reportQuery(SqlStatementDto statement, QueryResultDto result) {
        header(statement);
        for (String line : ResultTableFormatter.format(result)) {
            out.println(line);
        }
        out.flush();
    }

    /** updateCount < 0 nghĩa là driver không cho biết số dòng. */
    public void reportExecution(SqlStatementDto statement, int updateCount) {
        header(statement);
        if (updateCount >= 0) {
            out.printf("Rows affected: %d%n", updateCount);
        } else {
            out.println("OK");
        }
        out.flush();
    }

    private void header(SqlStatementDto statement) {
        out.printf("%n-- Statement %d (%s)%n", statement.getIndex(), statement.getKind().label());
    }
}
