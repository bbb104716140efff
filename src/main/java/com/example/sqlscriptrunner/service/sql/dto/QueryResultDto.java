package com.example.sqlscriptrunner.service.sql.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class QueryResultDto {
    List<String> columns;       // column label theo thứ tự của result set
    List<List<String>> rows;    // giá trị đã render, null -> "NULL"
}
