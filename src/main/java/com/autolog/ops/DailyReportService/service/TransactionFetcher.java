package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.dto.report.ReportWindow;
import com.autolog.ops.DailyReportService.dto.report.TransactionRecord;

import java.util.Collection;
import java.util.List;

public interface TransactionFetcher {

    /**
     * Approved transactions of the given locations inside the window, joined with customer and
     * vehicle data. Empty when nothing qualifies.
     *
     * @param customerId optional customer filter, {@code null} for all customers
     * @throws com.autolog.ops.DailyReportService.exception.FetchException on store failure
     */
    List<TransactionRecord> fetch(Collection<Long> locationIds, ReportWindow window, Long customerId);
}
