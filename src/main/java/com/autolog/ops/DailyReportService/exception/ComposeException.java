package com.autolog.ops.DailyReportService.exception;

import com.autolog.ops.DailyReportService.enums.OwnerRunState;

/**
 * Raised when the message parts do not line up, e.g. a cid reference without a matching inline asset.
 */
public class ComposeException extends DailyReportException {

    public ComposeException(String message) {
        super(OwnerRunState.SENDING, message);
    }

    public ComposeException(String message, Throwable cause) {
        super(OwnerRunState.SENDING, message, cause);
    }
}
