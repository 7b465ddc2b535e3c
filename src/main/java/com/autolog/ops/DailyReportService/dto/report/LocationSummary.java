package com.autolog.ops.DailyReportService.dto.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class LocationSummary implements ReportSummary {

    Long locationId;
    String locationName;
    BigDecimal total;
    long count;
    List<BreakdownEntry> paymentModes;
    List<BreakdownEntry> services;
    List<BreakdownEntry> vehicleTypes;
    List<HourlyBucket> hourly;
    List<TransactionRecord> rows;

    @Override
    public List<LocationSummary> getLocations() {
        return List.of(this);
    }
}
