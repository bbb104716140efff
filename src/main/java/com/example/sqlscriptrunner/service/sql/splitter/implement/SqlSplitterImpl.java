package com.example.sqlscriptrunner.service.sql.splitter.implement;

import java.io.Reader;
import java.util.List;

public interface SqlSplitterImpl {

    /**
     * Tách script thành các statement đã trim, theo đúng thứ tự xuất hiện; KHÔNG dùng regex.
     * An toàn với ';' nằm trong string, quoted identifier, comment và $tag$...$tag$.
     * Không bao giờ ném lỗi vì SQL sai cú pháp.
     */
    List<String> split(String script);

    /**
     * Như {@link #split(String)} nhưng đọc dần từ reader.
     * @throws com.example.sqlscriptrunner.exception.ScriptReadException nếu reader lỗi I/O
     */
    List<String> split(Reader reader);
}
