package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.dto.requestDto.ReportRunRequest;
import com.autolog.ops.DailyReportService.dto.responseDto.RunSummary;

public interface DailyReportOrchestrator {

    String TRIGGER_MANUAL = "MANUAL";
    String TRIGGER_SCHEDULED = "SCHEDULED_CRON";

    /**
     * Runs every selected owner and returns the run summary. Per-owner failures are recorded in
     * the summary, never thrown.
     *
     * @throws com.autolog.ops.DailyReportService.exception.RunSetupException when owners cannot be listed
     */
    RunSummary run(ReportRunRequest request);
}
