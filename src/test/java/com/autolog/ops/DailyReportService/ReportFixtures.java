package com.autolog.ops.DailyReportService;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.*;

import java.math.BigDecimal;
import java.time.*;
import java.util.List;

/**
 * Shared builders for report tests.
 */
public final class ReportFixtures {

    public static final ZoneOffset IST = ZoneOffset.ofHoursMinutes(5, 30);
    public static final LocalDate DAY = LocalDate.of(2025, 3, 14);
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-14T15:30:00Z"), ZoneOffset.UTC);

    public static final LocationRef L1 = new LocationRef(1L, "Main Street");
    public static final LocationRef L2 = new LocationRef(2L, "Harbour Road");

    private ReportFixtures() {
    }

    public static DailyReportProperties properties() {
        DailyReportProperties properties = new DailyReportProperties();
        properties.getMail().setFrom("reports@autolog.test");
        return properties;
    }

    public static ReportWindow window() {
        return new ReportWindow(DAY, IST, DAY.atStartOfDay().toInstant(IST), DAY.plusDays(1).atStartOfDay().toInstant(IST));
    }

    /** Record at the given local hour of {@link #DAY}. */
    public static TransactionRecord record(long id, LocationRef location, String amount, String paymentMode,
                                           String service, int localHour) {
        return TransactionRecord.builder()
                .id(id)
                .customerId(100L + id)
                .vehicleId(200L + id)
                .locationId(location.getId())
                .createdAt(DAY.atTime(localHour, 15).toInstant(IST))
                .amount(new BigDecimal(amount).setScale(2))
                .paymentMode(paymentMode)
                .service(service)
                .entryType("walk-in")
                .owner(new OwnerInfo("Customer " + id, "98765" + id))
                .vehicle(new VehicleInfo("KA01AB" + id, "Car", "Swift"))
                .build();
    }

    public static List<TransactionRecord> threeRecordsAtL1() {
        return List.of(
                record(1, L1, "100", "cash", "Wash", 9),
                record(2, L1, "250", "upi", "Polish", 11),
                record(3, L1, "150", "cash", "Wash", 11));
    }
}
