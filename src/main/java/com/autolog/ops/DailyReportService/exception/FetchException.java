package com.autolog.ops.DailyReportService.exception;

import com.autolog.ops.DailyReportService.enums.OwnerRunState;

public class FetchException extends DailyReportException {

    public FetchException(String message) {
        super(OwnerRunState.FETCHING, message);
    }

    public FetchException(String message, Throwable cause) {
        super(OwnerRunState.FETCHING, message, cause);
    }
}
