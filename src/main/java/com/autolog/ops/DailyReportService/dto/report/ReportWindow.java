package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Half-open UTC interval {@code [start, end)} covering one calendar day at a fixed offset.
 */
@Value
public class ReportWindow {

    LocalDate date;
    ZoneOffset offset;
    Instant start;
    Instant end;
}
