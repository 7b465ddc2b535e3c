package com.autolog.ops.DailyReportService.exception;

import com.autolog.ops.DailyReportService.enums.OwnerRunState;

/**
 * Unexpected failure inside an owner's pipeline, tagged with the stage that was running.
 */
public class PipelineStageException extends DailyReportException {

    public PipelineStageException(OwnerRunState state, String message, Throwable cause) {
        super(state, message, cause);
    }
}
