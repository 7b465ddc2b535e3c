package com.autolog.ops.DailyReportService.util;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@AllArgsConstructor
@NoArgsConstructor
@Data
public class StandardResponse {

    private int statusCode;
    private String message;
    private Object data;
}
