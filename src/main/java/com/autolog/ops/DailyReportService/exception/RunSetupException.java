package com.autolog.ops.DailyReportService.exception;

/**
 * Raised when a run cannot start at all, e.g. the owner listing is unavailable.
 */
public class RunSetupException extends RuntimeException {

    public RunSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
