package com.autolog.ops.DailyReportService.dto.responseDto;

import com.autolog.ops.DailyReportService.dto.report.LocationRef;
import com.autolog.ops.DailyReportService.dto.report.OwnerRunContext;
import com.autolog.ops.DailyReportService.enums.OwnerRunState;
import com.autolog.ops.DailyReportService.enums.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class RunResult {

    public static final String NO_RECIPIENT = "no recipient";
    public static final String NO_DATA = "no data";

    Long ownerId;
    String ownerName;
    String recipient;
    RunStatus status;
    String reason;
    OwnerRunState lastState;
    int templateUsed;
    long recordCount;
    BigDecimal revenue;
    List<LocationRef> locations;

    public static RunResult sent(OwnerRunContext context, long recordCount, BigDecimal revenue) {
        return base(context)
                .status(RunStatus.SENT)
                .lastState(OwnerRunState.SENT)
                .recordCount(recordCount)
                .revenue(revenue)
                .build();
    }

    public static RunResult skipped(OwnerRunContext context, String reason) {
        return base(context)
                .status(RunStatus.SKIPPED)
                .lastState(OwnerRunState.SKIPPED)
                .reason(reason)
                .build();
    }

    public static RunResult failed(OwnerRunContext context, OwnerRunState reachedState, String reason) {
        return base(context)
                .status(RunStatus.FAILED)
                .lastState(reachedState)
                .reason(reason)
                .build();
    }

    private static RunResultBuilder base(OwnerRunContext context) {
        return RunResult.builder()
                .ownerId(context.getOwnerId())
                .ownerName(context.getOwnerName())
                .recipient(context.getRecipient())
                .templateUsed(context.getTemplateSelector())
                .revenue(BigDecimal.ZERO)
                .locations(context.getLocations());
    }
}
