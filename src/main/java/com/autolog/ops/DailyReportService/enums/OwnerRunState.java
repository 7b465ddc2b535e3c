package com.autolog.ops.DailyReportService.enums;

/**
 * Progress of one owner through a run. SENDING covers composing and handing the message to
 * the transport. SENT and SKIPPED are terminal; FAILED is reported only when an error escapes
 * outside any stage.
 */
public enum OwnerRunState {
    PENDING,
    FETCHING,
    AGGREGATING,
    RENDERING,
    SENDING,
    SENT,
    SKIPPED,
    FAILED
}
