package com.example.sqlscriptrunner.service.connection.service;

import com.example.sqlscriptrunner.config.RunnerConfig;
import com.example.sqlscriptrunner.dto.RunSettings;
import com.example.sqlscriptrunner.service.connection.implement.DataSourceFactoryImpl;
import com.zaxxer.hikari.HikariDataSource;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;

/**
 * DataSource Hikari một connection, dựng từ tham số command line.
 * Script chạy tuần tự trong một transaction nên không cần pool lớn hơn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataSourceFactory implements DataSourceFactoryImpl {
    private final RunnerConfig config;

    @Override
    public DataSource create(@NonNull RunSettings settings) {
        String url = settings.jdbcUrl();
        HikariDataSource ds = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(url)
                .username(settings.getUsername())
                .password(settings.getPassword())
                .build();
        ds.setPoolName(config.getPoolName());
        ds.setMaximumPoolSize(1);
        ds.setMinimumIdle(0);
        ds.setAutoCommit(false);
        log.info("Connecting to {} as {}", url, settings.getUsername());
        return ds;
    }
}
