package com.autolog.ops.DailyReportService.scheduler;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.requestDto.ReportRunRequest;
import com.autolog.ops.DailyReportService.dto.responseDto.RunSummary;
import com.autolog.ops.DailyReportService.exception.RunSetupException;
import com.autolog.ops.DailyReportService.service.DailyReportOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@EnableScheduling
public class DailyReportScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DailyReportScheduler.class);

    private final DailyReportOrchestrator dailyReportOrchestrator;
    private final DailyReportProperties dailyReportProperties;

    public DailyReportScheduler(DailyReportOrchestrator dailyReportOrchestrator, DailyReportProperties dailyReportProperties) {
        this.dailyReportOrchestrator = dailyReportOrchestrator;
        this.dailyReportProperties = dailyReportProperties;
    }

    @Scheduled(cron = "${report.schedule.cron:0 0 21 * * *}", zone = "${report.schedule.zone:Asia/Kolkata}")
    public void sendDailyReports() {
        if (!dailyReportProperties.getSchedule().isEnabled()) {
            LOGGER.debug("Daily report cron disabled, skipping");
            return;
        }
        LOGGER.info("Daily report Cron start");
        try {
            RunSummary summary = dailyReportOrchestrator.run(ReportRunRequest.builder()
                    .triggerSource(DailyReportOrchestrator.TRIGGER_SCHEDULED)
                    .build());
            LOGGER.info("Daily report Cron end: {} sent, {} skipped, {} failed",
                    summary.getSent(), summary.getSkipped(), summary.getFailed());
        } catch (RunSetupException e) {
            LOGGER.error("Daily report Cron aborted: {}", e.getMessage(), e);
        }
    }
}
