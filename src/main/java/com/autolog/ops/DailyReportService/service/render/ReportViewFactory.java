package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.dto.report.*;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.autolog.ops.DailyReportService.util.ReportFormatUtils.*;

@Component
public class ReportViewFactory {

    public static final String ALL_LOCATIONS = "All Locations";

    private final Clock clock;

    public ReportViewFactory(Clock clock) {
        this.clock = clock;
    }

    public ReportView create(ReportSummary summary, ReportWindow window, String ownerName) {
        BigDecimal total = summary.getTotal();

        List<ReportView.HourRow> hours = new ArrayList<>();
        BigDecimal maxHour = summary.getHourly().stream().map(HourlyBucket::getAmount).max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO);
        HourlyBucket peak = null;
        for (HourlyBucket bucket : summary.getHourly()) {
            if (bucket.getCount() == 0) {
                continue;
            }
            if (peak == null || bucket.getAmount().compareTo(peak.getAmount()) > 0) {
                peak = bucket;
            }
            hours.add(new ReportView.HourRow(hourLabel(bucket.getHour()), bucket.getCount(),
                    currency(bucket.getAmount()), barPercent(bucket.getAmount(), maxHour)));
        }

        BreakdownEntry topService = summary.getServices().isEmpty() ? null : summary.getServices().get(0);

        List<ReportView.LocationRow> locations = new ArrayList<>();
        for (LocationSummary location : summary.getLocations()) {
            locations.add(new ReportView.LocationRow(orPlaceholder(location.getLocationName()), location.getCount(),
                    currency(location.getTotal()), percent(location.getTotal(), total)));
        }

        return ReportView.builder()
                .reportDate(window.getDate().format(DISPLAY_DATE))
                .locationLabel(locationLabel(summary))
                .ownerName(orPlaceholder(ownerName))
                .generatedAt(LocalDateTime.now(clock.withZone(window.getOffset())).format(DISPLAY_DATE_TIME))
                .consolidated(summary.getLocations().size() > 1)
                .totalRevenue(currency(total))
                .transactionCount(summary.getCount())
                .averageTicket(currency(average(total, summary.getCount())))
                .peakHour(peak == null ? PLACEHOLDER : hourLabel(peak.getHour()))
                .peakHourRevenue(currency(peak == null ? BigDecimal.ZERO : peak.getAmount()))
                .topService(topService == null ? PLACEHOLDER : orPlaceholder(topService.getLabel()))
                .topServiceRevenue(currency(topService == null ? BigDecimal.ZERO : topService.getAmount()))
                .payments(rows(summary.getPaymentModes(), total))
                .services(rows(summary.getServices(), total))
                .vehicleTypes(rows(summary.getVehicleTypes(), total))
                .hours(hours)
                .locations(locations)
                .paymentSeries(series(summary.getPaymentModes()))
                .serviceSeries(series(summary.getServices()))
                .hourlySeries(summary.getHourly().stream().map(HourlyBucket::getAmount).collect(Collectors.toList()))
                .build();
    }

    public static String locationLabel(ReportSummary summary) {
        List<LocationSummary> locations = summary.getLocations();
        if (locations.size() == 1) {
            return orPlaceholder(locations.get(0).getLocationName());
        }
        return ALL_LOCATIONS;
    }

    private static List<ReportView.BreakdownRow> rows(List<BreakdownEntry> entries, BigDecimal total) {
        List<ReportView.BreakdownRow> rows = new ArrayList<>(entries.size());
        for (BreakdownEntry entry : entries) {
            List<String> details = new ArrayList<>();
            if (entry.hasDetails()) {
                for (Map.Entry<String, Tally> detail : entry.getDetails().entrySet()) {
                    details.add(detail.getKey() + ": " + currency(detail.getValue().getAmount())
                            + " (" + detail.getValue().getCount() + " vehicles)");
                }
            }
            rows.add(new ReportView.BreakdownRow(
                    orPlaceholder(entry.getLabel()),
                    entry.getCount(),
                    currency(entry.getAmount()),
                    percent(entry.getAmount(), total),
                    currency(average(entry.getAmount(), entry.getCount())),
                    barPercent(entry.getAmount(), total),
                    details));
        }
        return rows;
    }

    private static List<BigDecimal> series(List<BreakdownEntry> entries) {
        return entries.stream().map(BreakdownEntry::getAmount).collect(Collectors.toList());
    }

    private static int barPercent(BigDecimal value, BigDecimal max) {
        if (max == null || max.signum() <= 0 || value == null) {
            return 0;
        }
        return value.multiply(BigDecimal.valueOf(100)).divide(max, 0, RoundingMode.HALF_UP).intValue();
    }
}
