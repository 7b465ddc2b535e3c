package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.dto.report.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Reduces fetched transactions into location summaries and merges those into one owner summary.
 * All sums are exact decimals and every breakdown is sorted by amount, then key, so the result
 * does not depend on input order.
 */
@Component
public class ReportAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportAggregator.class);

    public static final String UNSPECIFIED = "unspecified";
    private static final int HOURS = 24;
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private static final Comparator<BreakdownEntry> BY_AMOUNT_THEN_KEY = Comparator
            .comparing(BreakdownEntry::getAmount, Comparator.reverseOrder())
            .thenComparing(BreakdownEntry::getKey);

    public LocationSummary aggregate(LocationRef location, List<TransactionRecord> records, ZoneOffset offset) {
        Breakdown paymentModes = new Breakdown();
        Breakdown services = new Breakdown();
        Breakdown vehicleTypes = new Breakdown();
        Tally[] hours = emptyHours();
        BigDecimal total = ZERO;

        for (TransactionRecord record : records) {
            BigDecimal amount = record.getAmount() == null ? ZERO : record.getAmount();
            total = total.add(amount);

            String mode = normalizePaymentMode(record.getPaymentMode());
            paymentModes.add(mode, mode.toUpperCase(Locale.ROOT), amount, record.getPayerName());

            String service = normalizeCategory(record.getService());
            services.add(service, service, amount, null);

            String vehicleType = normalizeCategory(record.getVehicle() == null ? null : record.getVehicle().getVehicleType());
            vehicleTypes.add(vehicleType, vehicleType, amount, null);

            if (record.getCreatedAt() != null) {
                int hour = record.getCreatedAt().atOffset(offset).getHour();
                hours[hour] = hours[hour].plus(1, amount);
            }
        }

        LocationSummary summary = LocationSummary.builder()
                .locationId(location.getId())
                .locationName(location.getName())
                .total(total)
                .count(records.size())
                .paymentModes(paymentModes.entries())
                .services(services.entries())
                .vehicleTypes(vehicleTypes.entries())
                .hourly(toBuckets(hours))
                .rows(List.copyOf(records))
                .build();
        LOGGER.debug("Aggregated location {} ({}): {} records, total {}", location.getId(), location.getName(), records.size(), total);
        return summary;
    }

    /**
     * Merges summaries in the given order. No summaries yield an all-zero summary.
     */
    public ConsolidatedSummary consolidate(List<LocationSummary> summaries) {
        Breakdown paymentModes = new Breakdown();
        Breakdown services = new Breakdown();
        Breakdown vehicleTypes = new Breakdown();
        Tally[] hours = emptyHours();
        BigDecimal total = ZERO;
        long count = 0;
        List<TransactionRecord> rows = new ArrayList<>();

        for (LocationSummary summary : summaries) {
            total = total.add(summary.getTotal());
            count += summary.getCount();
            paymentModes.merge(summary.getPaymentModes());
            services.merge(summary.getServices());
            vehicleTypes.merge(summary.getVehicleTypes());
            for (HourlyBucket bucket : summary.getHourly()) {
                hours[bucket.getHour()] = hours[bucket.getHour()].plus(bucket.getCount(), bucket.getAmount());
            }
            rows.addAll(summary.getRows());
        }

        return ConsolidatedSummary.builder()
                .total(total)
                .count(count)
                .paymentModes(paymentModes.entries())
                .services(services.entries())
                .vehicleTypes(vehicleTypes.entries())
                .hourly(toBuckets(hours))
                .rows(Collections.unmodifiableList(rows))
                .locations(List.copyOf(summaries))
                .build();
    }

    static String normalizePaymentMode(String mode) {
        String value = normalizeCategory(mode);
        return value.toLowerCase(Locale.ROOT);
    }

    static String normalizeCategory(String value) {
        if (value == null || value.isBlank()) {
            return UNSPECIFIED;
        }
        return value.trim();
    }

    private static Tally[] emptyHours() {
        Tally[] hours = new Tally[HOURS];
        Arrays.fill(hours, Tally.ZERO);
        return hours;
    }

    private static List<HourlyBucket> toBuckets(Tally[] hours) {
        List<HourlyBucket> buckets = new ArrayList<>(HOURS);
        for (int hour = 0; hour < HOURS; hour++) {
            buckets.add(new HourlyBucket(hour, hours[hour].getCount(), hours[hour].getAmount()));
        }
        return Collections.unmodifiableList(buckets);
    }

    /**
     * Mutable accumulator for one breakdown dimension.
     */
    private static final class Breakdown {

        private final Map<String, String> labels = new TreeMap<>();
        private final Map<String, Tally> tallies = new TreeMap<>();
        private final Map<String, Map<String, Tally>> details = new TreeMap<>();

        void add(String key, String label, BigDecimal amount, String detail) {
            labels.putIfAbsent(key, label);
            tallies.merge(key, new Tally(1, amount), Tally::plus);
            if (detail != null && !detail.isBlank()) {
                details.computeIfAbsent(key, k -> new TreeMap<>())
                        .merge(detail.trim(), new Tally(1, amount), Tally::plus);
            }
        }

        void merge(List<BreakdownEntry> entries) {
            for (BreakdownEntry entry : entries) {
                labels.putIfAbsent(entry.getKey(), entry.getLabel());
                tallies.merge(entry.getKey(), new Tally(entry.getCount(), entry.getAmount()), Tally::plus);
                if (entry.hasDetails()) {
                    Map<String, Tally> target = details.computeIfAbsent(entry.getKey(), k -> new TreeMap<>());
                    entry.getDetails().forEach((name, tally) -> target.merge(name, tally, Tally::plus));
                }
            }
        }

        List<BreakdownEntry> entries() {
            List<BreakdownEntry> entries = new ArrayList<>(tallies.size());
            tallies.forEach((key, tally) -> entries.add(new BreakdownEntry(
                    key,
                    labels.get(key),
                    tally.getCount(),
                    tally.getAmount(),
                    Collections.unmodifiableMap(new TreeMap<>(details.getOrDefault(key, Collections.emptyMap()))))));
            entries.sort(BY_AMOUNT_THEN_KEY);
            return Collections.unmodifiableList(entries);
        }
    }
}
