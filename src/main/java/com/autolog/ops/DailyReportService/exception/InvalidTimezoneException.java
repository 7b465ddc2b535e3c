package com.autolog.ops.DailyReportService.exception;

import com.autolog.ops.DailyReportService.enums.OwnerRunState;

/**
 * Raised when a timezone override is neither a UTC offset nor a known zone id.
 */
public class InvalidTimezoneException extends DailyReportException {

    public InvalidTimezoneException(String message) {
        super(OwnerRunState.PENDING, message);
    }

    public InvalidTimezoneException(String message, Throwable cause) {
        super(OwnerRunState.PENDING, message, cause);
    }
}
