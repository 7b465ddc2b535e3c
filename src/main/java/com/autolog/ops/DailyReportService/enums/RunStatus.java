package com.autolog.ops.DailyReportService.enums;

public enum RunStatus {
    SENT, SKIPPED, FAILED
}
