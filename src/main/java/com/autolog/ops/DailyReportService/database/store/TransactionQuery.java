package com.autolog.ops.DailyReportService.database.store;

import lombok.Value;

import java.time.Instant;
import java.util.Collection;

@Value
public class TransactionQuery {

    Collection<Long> locationIds;
    Instant start;
    Instant end;
    // optional cust_id filter
    Long customerId;
}
