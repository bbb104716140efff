package com.example.sqlscriptrunner.service.connection.implement;

import com.example.sqlscriptrunner.dto.RunSettings;

import javax.sql.DataSource;

public interface DataSourceFactoryImpl {
    /**
     * Tạo DataSource cho một lần chạy script. Caller chịu trách nhiệm đóng nó
     * (nếu là {@link AutoCloseable}) sau khi chạy xong.
     */
    DataSource create(RunSettings settings);
}
