package com.example.sqlscriptrunner.dto;

import com.example.sqlscriptrunner.service.connection.DatabaseEngine;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RunSettings {
    DatabaseEngine engine;
    String host;
    int port;
    String username;
    String password;
    String dbname;
    String sqlPath;

    public String jdbcUrl() {
        return engine.jdbcUrl(host, port, dbname);
    }

    @Override
    public String toString() {
        // không log password
        return "RunSettings(engine=" + engine + ", host=" + host + ", port=" + port
                + ", username=" + username + ", dbname=" + dbname + ", sqlPath=" + sqlPath + ")";
    }
}
