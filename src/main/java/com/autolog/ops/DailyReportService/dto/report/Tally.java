package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Tally {

    public static final Tally ZERO = new Tally(0, BigDecimal.ZERO.setScale(2));

    long count;
    BigDecimal amount;

    public Tally plus(long otherCount, BigDecimal otherAmount) {
        return new Tally(count + otherCount, amount.add(otherAmount));
    }

    public Tally plus(Tally other) {
        return plus(other.count, other.amount);
    }
}
