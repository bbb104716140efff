package com.example.sqlscriptrunner.exception;

import com.example.sqlscriptrunner.config.ErrorConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Điểm xử lý lỗi tập trung của runner: in thông báo cho người dùng ra stderr
 * và trả về exit code cho process.
 */
@Slf4j
@Component
public class GlobalExceptionHandler {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final PrintStream err;

    public GlobalExceptionHandler() {
        this(System.err);
    }

    public GlobalExceptionHandler(PrintStream err) {
        this.err = err;
    }

    public int handle(Throwable ex) {
        if (ex instanceof AppException app) {
            return handleAppException(app);
        }
        return handleGenericException(ex);
    }

    private int handleAppException(AppException ex) {
        log.debug("[{}] {}", ex.getErrorCode(), ex.getMessage(), ex);
        err.println(ex.getMessage());
        err.flush();
        return EXIT_FAILURE;
    }

    private int handleGenericException(Throwable ex) {
        log.error("[{}] Unexpected failure: ", ErrorConfig.INTERNAL_ERROR, ex);
        err.println("unexpected error: " + ex.getMessage());
        err.flush();
        return EXIT_FAILURE;
    }
}
