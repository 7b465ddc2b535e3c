package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

import java.util.Map;

@Value
public class RenderedReport {

    int selector;
    String subject;
    String html;
    String text;
    /** Keyed by content id, insertion ordered. Empty for the plain template. */
    Map<String, InlineAsset> assets;
}
