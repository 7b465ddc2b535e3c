package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

/**
 * Binary part of a rendered report, referenced from the html body as {@code cid:<contentId>}.
 */
@Value
public class InlineAsset {

    String contentId;
    byte[] bytes;
    String mimeType;
}
