package com.example.sqlscriptrunner.service.sql.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SqlStatementDto {

    private int index;            // vị trí trong script, bắt đầu từ 1
    private StatementKind kind;   // QUERY / EXECUTION
    private String content;       // nội dung câu, đã trim

    public static SqlStatementDto of(int index, String content) {
        return SqlStatementDto.builder()
                .index(index)
                .kind(StatementKind.of(content))
                .content(content)
                .build();
    }
}
