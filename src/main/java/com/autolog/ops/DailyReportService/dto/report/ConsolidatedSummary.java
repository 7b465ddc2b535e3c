package com.autolog.ops.DailyReportService.dto.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Union of an owner's location summaries. Totals equal the sum of {@link #locations}; rows are
 * the locations' rows concatenated in location order.
 */
@Value
@Builder
public class ConsolidatedSummary implements ReportSummary {

    BigDecimal total;
    long count;
    List<BreakdownEntry> paymentModes;
    List<BreakdownEntry> services;
    List<BreakdownEntry> vehicleTypes;
    List<HourlyBucket> hourly;
    List<TransactionRecord> rows;
    List<LocationSummary> locations;
}
