package com.autolog.ops.DailyReportService.service.render;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Display-ready values handed to the report templates. Every optional value is already
 * substituted with a placeholder.
 */
@Value
@Builder
public class ReportView {

    String reportDate;
    String locationLabel;
    String ownerName;
    String generatedAt;
    boolean consolidated;

    String totalRevenue;
    long transactionCount;
    String averageTicket;
    String peakHour;
    String peakHourRevenue;
    String topService;
    String topServiceRevenue;

    List<BreakdownRow> payments;
    List<BreakdownRow> services;
    List<BreakdownRow> vehicleTypes;
    List<HourRow> hours;
    List<LocationRow> locations;

    // raw series for chart images
    List<BigDecimal> paymentSeries;
    List<BigDecimal> serviceSeries;
    List<BigDecimal> hourlySeries;

    @Value
    public static class BreakdownRow {
        String label;
        long count;
        String amount;
        String share;
        String average;
        /** Whole percent, 0..100, for bar widths. */
        int barPercent;
        List<String> details;

        public boolean hasDetails() {
            return details != null && !details.isEmpty();
        }
    }

    @Value
    public static class HourRow {
        String label;
        long count;
        String amount;
        int barPercent;
    }

    @Value
    public static class LocationRow {
        String name;
        long count;
        String amount;
        String share;
    }
}
