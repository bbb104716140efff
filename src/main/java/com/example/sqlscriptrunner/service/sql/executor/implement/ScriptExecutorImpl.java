package com.example.sqlscriptrunner.service.sql.executor.implement;

import javax.sql.DataSource;
import java.util.List;

public interface ScriptExecutorImpl {
    /**
     * Chạy lần lượt các statement trong MỘT transaction; lỗi ở bất kỳ câu nào sẽ rollback toàn bộ.
     * @return số statement đã chạy (bằng statements.size() khi commit thành công)
     * @throws com.example.sqlscriptrunner.exception.AppException mã EXECUTION_FAILED khi connect/chạy/commit lỗi
     */
    int execute(DataSource dataSource, List<String> statements);
}
