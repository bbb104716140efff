package com.example.sqlscriptrunner.exception;

import com.example.sqlscriptrunner.config.ErrorConfig;

import java.io.IOException;

/**
 * Lỗi đọc từ nguồn ký tự của script. Đây là lỗi duy nhất mà splitter ném ra;
 * SQL sai cú pháp không bao giờ là lỗi ở tầng này.
 */
public class ScriptReadException extends AppException {

    public ScriptReadException(String message, IOException cause) {
        super(ErrorConfig.SCRIPT_READ_FAILED, message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
