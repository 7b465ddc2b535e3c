package com.autolog.ops.DailyReportService.exception;

import com.autolog.ops.DailyReportService.enums.OwnerRunState;
import lombok.Getter;

/**
 * Base of every per-owner pipeline failure. The state records how far the owner got.
 */
@Getter
public abstract class DailyReportException extends RuntimeException {

    private final OwnerRunState state;

    protected DailyReportException(OwnerRunState state, String message) {
        super(message);
        this.state = state;
    }

    protected DailyReportException(OwnerRunState state, String message, Throwable cause) {
        super(message, cause);
        this.state = state;
    }
}
