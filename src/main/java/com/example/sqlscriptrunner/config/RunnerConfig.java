package com.example.sqlscriptrunner.config;

import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Data
@NoArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RunnerConfig {

    @Value("${runner.default-username:db_admin}")
    String defaultUsername = "db_admin";

    @Value("${runner.query-timeout:5m}")
    Duration queryTimeout = Duration.ofMinutes(5);

    /** Số ký tự tối đa được peek khi dò dollar tag. */
    @Value("${runner.lookahead-window:64}")
    int lookaheadWindow = 64;

    @Value("${runner.pool-name:sql-script-runner}")
    String poolName = "sql-script-runner";
}
