package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

@Value
public class LocationRef {

    Long id;
    String name;
}
