package com.autolog.ops.DailyReportService.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Locale-independent rendering of amounts, shares and dates used across the report outputs.
 */
public final class ReportFormatUtils {

    public static final String PLACEHOLDER = "N/A";
    public static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy", Locale.ROOT);
    public static final DateTimeFormatter DISPLAY_DATE_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm", Locale.ROOT);
    public static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final String CURRENCY_SYMBOL = "₹";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private ReportFormatUtils() {
    }

    /** Plain two-decimal amount, e.g. {@code 1234.50}. */
    public static String plainAmount(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /** Grouped amount with currency symbol, e.g. {@code ₹1,234.50}. */
    public static String currency(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        // DecimalFormat is not thread safe
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return CURRENCY_SYMBOL + format.format(value);
    }

    public static BigDecimal share(BigDecimal part, BigDecimal total) {
        if (total == null || total.signum() == 0 || part == null) {
            return BigDecimal.ZERO.setScale(1);
        }
        return part.multiply(HUNDRED).divide(total, 1, RoundingMode.HALF_UP);
    }

    public static String percent(BigDecimal part, BigDecimal total) {
        return share(part, total).toPlainString() + "%";
    }

    public static BigDecimal average(BigDecimal amount, long count) {
        if (count == 0 || amount == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        return amount.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }

    public static String orPlaceholder(String value) {
        return value == null || value.isBlank() ? PLACEHOLDER : value;
    }

    public static String orEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    /** 0..23 to a 12 hour label, e.g. {@code 9:00 AM}. */
    public static String hourLabel(int hour) {
        int hour12 = hour % 12 == 0 ? 12 : hour % 12;
        return hour12 + ":00 " + (hour < 12 ? "AM" : "PM");
    }

    /** Lower-case, non alphanumerics replaced by '-', for use in file names. */
    public static String slug(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.trim().replaceAll("[^a-zA-Z0-9]", "-").toLowerCase(Locale.ROOT);
    }
}
