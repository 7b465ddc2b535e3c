package com.autolog.ops.DailyReportService.exception;

import com.autolog.ops.DailyReportService.enums.OwnerRunState;

public class TransportException extends DailyReportException {

    public TransportException(String message) {
        super(OwnerRunState.SENDING, message);
    }

    public TransportException(String message, Throwable cause) {
        super(OwnerRunState.SENDING, message, cause);
    }
}
