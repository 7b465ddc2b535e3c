package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

/**
 * Display identity of the customer behind a transaction. Shared between records of the same customer.
 */
@Value
public class OwnerInfo {

    public static final OwnerInfo UNKNOWN = new OwnerInfo(null, null);

    String name;
    String contact;
}
