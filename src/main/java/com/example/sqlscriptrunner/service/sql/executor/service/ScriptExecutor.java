package com.example.sqlscriptrunner.service.sql.executor.service;

import com.example.sqlscriptrunner.config.ErrorConfig;
import com.example.sqlscriptrunner.config.RunnerConfig;
import com.example.sqlscriptrunner.exception.AppException;
import com.example.sqlscriptrunner.service.sql.dto.QueryResultDto;
import com.example.sqlscriptrunner.service.sql.dto.SqlStatementDto;
import com.example.sqlscriptrunner.service.sql.dto.StatementKind;
import com.example.sqlscriptrunner.service.sql.executor.implement.ScriptExecutorImpl;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.StatementCallback;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Executor
 * - Mọi statement chạy tuần tự trong một transaction (TransactionTemplate).
 * - QUERY: in bảng kết quả; EXECUTION: in số dòng bị ảnh hưởng hoặc OK.
 * - Câu nào lỗi -> rollback cả script; phần đã in ra trước đó giữ nguyên.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptExecutor implements ScriptExecutorImpl {
    static final String NULL_LITERAL = "NULL";

    private final RunnerConfig config;
    private final ExecutionReporter reporter;

    @Override
    public int execute(@NonNull DataSource dataSource, @NonNull List<String> statements) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout(Math.toIntExact(config.getQueryTimeout().getSeconds()));
        TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));

        try {
            Integer executed = tx.execute(status -> {
                int count = 0;
                for (int i = 0; i < statements.size(); i++) {
                    run(jdbc, SqlStatementDto.of(i + 1, statements.get(i)));
                    count++;
                }
                return count;
            });
            log.info("Committed {} statement(s)", executed);
            return executed == null ? 0 : executed;
        } catch (CannotCreateTransactionException e) {
            throw new AppException(ErrorConfig.EXECUTION_FAILED, "failed to connect: " + rootMessage(e), e);
        } catch (TransactionException e) {
            throw new AppException(ErrorConfig.EXECUTION_FAILED, "failed to commit transaction: " + rootMessage(e), e);
        }
    }

    /* ================= Helpers ================= */

    private void run(JdbcTemplate jdbc, SqlStatementDto statement) {
        log.debug("Executing statement {} ({})", statement.getIndex(), statement.getKind());
        try {
            if (statement.getKind() == StatementKind.QUERY) {
                QueryResultDto result = jdbc.query(statement.getContent(),
                        (ResultSetExtractor<QueryResultDto>) ScriptExecutor::collect);
                reporter.reportQuery(statement, result);
            } else {
                Integer updateCount = jdbc.execute((StatementCallback<Integer>) st -> {
                    st.execute(statement.getContent());
                    return st.getUpdateCount();
                });
                reporter.reportExecution(statement, updateCount == null ? -1 : updateCount);
            }
        } catch (DataAccessException e) {
            log.debug("Statement {} failed", statement.getIndex(), e);
            throw new AppException(ErrorConfig.EXECUTION_FAILED,
                    "statement " + statement.getIndex() + " failed: " + rootMessage(e), e);
        }
    }

    private static QueryResultDto collect(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<List<String>> rows = new ArrayList<>();
        while (rs.next()) {
            List<String> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(render(rs.getObject(i)));
            }
            rows.add(row);
        }
        return QueryResultDto.builder()
                .columns(columns)
                .rows(rows)
                .build();
    }

    static String render(Object value) {
        if (value == null) return NULL_LITERAL;
        if (value instanceof byte[] bytes) return new String(bytes, StandardCharsets.UTF_8);
        return value.toString();
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.toString();
    }
}
