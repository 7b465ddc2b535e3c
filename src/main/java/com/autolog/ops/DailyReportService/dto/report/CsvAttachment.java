package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

import java.nio.charset.StandardCharsets;

@Value
public class CsvAttachment {

    public static final String CONTENT_TYPE = "text/csv";

    String fileName;
    String content;

    public byte[] getBytes() {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
