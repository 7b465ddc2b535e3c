package com.autolog.ops.DailyReportService.dto.responseDto;

import com.autolog.ops.DailyReportService.enums.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class RunSummary {

    LocalDate reportDate;
    String triggerSource;
    int totalOwners;
    int sent;
    int skipped;
    int failed;
    long totalRecords;
    BigDecimal totalRevenue;
    List<RunResult> results;

    /**
     * Folds per-owner results, in owner order, into the run-level counts.
     */
    public static RunSummary of(LocalDate reportDate, String triggerSource, List<RunResult> results) {
        int sent = 0;
        int skipped = 0;
        int failed = 0;
        long records = 0;
        BigDecimal revenue = BigDecimal.ZERO;
        for (RunResult result : results) {
            if (result.getStatus() == RunStatus.SENT) {
                sent++;
                records += result.getRecordCount();
                revenue = revenue.add(result.getRevenue());
            } else if (result.getStatus() == RunStatus.SKIPPED) {
                skipped++;
            } else {
                failed++;
            }
        }
        return RunSummary.builder()
                .reportDate(reportDate)
                .triggerSource(triggerSource)
                .totalOwners(results.size())
                .sent(sent)
                .skipped(skipped)
                .failed(failed)
                .totalRecords(records)
                .totalRevenue(revenue)
                .results(List.copyOf(results))
                .build();
    }
}
