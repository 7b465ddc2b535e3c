package com.autolog.ops.DailyReportService.dto.report;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregate shape shared by a single location and a consolidated owner report.
 */
public interface ReportSummary {

    BigDecimal getTotal();

    long getCount();

    List<BreakdownEntry> getPaymentModes();

    List<BreakdownEntry> getServices();

    List<BreakdownEntry> getVehicleTypes();

    /** 24 buckets, hour 0 first, in the report's regional offset. */
    List<HourlyBucket> getHourly();

    List<TransactionRecord> getRows();

    List<LocationSummary> getLocations();
}
