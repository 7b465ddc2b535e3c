package com.autolog.ops.DailyReportService.exception;

import com.autolog.ops.DailyReportService.enums.OwnerRunState;

public class RenderException extends DailyReportException {

    public RenderException(String message) {
        super(OwnerRunState.RENDERING, message);
    }

    public RenderException(String message, Throwable cause) {
        super(OwnerRunState.RENDERING, message, cause);
    }
}
