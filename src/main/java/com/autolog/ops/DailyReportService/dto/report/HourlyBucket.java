package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class HourlyBucket {

    int hour;
    long count;
    BigDecimal amount;
}
