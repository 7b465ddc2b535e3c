package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One group of a breakdown. {@code details} holds the payer-display split, keyed by payer name.
 */
@Value
public class BreakdownEntry {

    String key;
    String label;
    long count;
    BigDecimal amount;
    Map<String, Tally> details;

    public boolean hasDetails() {
        return details != null && !details.isEmpty();
    }
}
