package com.autolog.ops.DailyReportService.controller;

import com.autolog.ops.DailyReportService.dto.requestDto.ReportRunRequest;
import com.autolog.ops.DailyReportService.dto.responseDto.RunSummary;
import com.autolog.ops.DailyReportService.service.DailyReportOrchestrator;
import com.autolog.ops.DailyReportService.util.StandardResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/reports")
public class DailyReportController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DailyReportController.class);

    private final DailyReportOrchestrator dailyReportOrchestrator;

    public DailyReportController(DailyReportOrchestrator dailyReportOrchestrator) {
        this.dailyReportOrchestrator = dailyReportOrchestrator;
    }

    @PostMapping("/daily")
    public ResponseEntity<StandardResponse> runDailyReports(@Valid @RequestBody(required = false) ReportRunRequest request) {
        LOGGER.info("Request came to run daily reports: {}", request);
        RunSummary summary = dailyReportOrchestrator.run(request == null ? new ReportRunRequest() : request);
        String message = String.format("Reports processed: %d sent, %d skipped, %d failed",
                summary.getSent(), summary.getSkipped(), summary.getFailed());
        return new ResponseEntity<>(
                new StandardResponse(
                        HttpStatus.OK.value(),
                        message,
                        summary
                ),
                HttpStatus.OK
        );
    }

    @GetMapping("/health")
    public ResponseEntity<StandardResponse> health() {
        return new ResponseEntity<>(
                new StandardResponse(
                        HttpStatus.OK.value(),
                        "Daily report service is up",
                        Map.of("status", "UP")
                ),
                HttpStatus.OK
        );
    }
}
