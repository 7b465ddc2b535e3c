package com.autolog.ops.DailyReportService.service.impl;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.LocationRef;
import com.autolog.ops.DailyReportService.dto.report.OwnerRunContext;
import com.autolog.ops.DailyReportService.dto.report.OwnerSchedule;
import com.autolog.ops.DailyReportService.dto.requestDto.ReportRunRequest;
import com.autolog.ops.DailyReportService.dto.responseDto.RunResult;
import com.autolog.ops.DailyReportService.dto.responseDto.RunSummary;
import com.autolog.ops.DailyReportService.enums.OwnerRunState;
import com.autolog.ops.DailyReportService.exception.DailyReportException;
import com.autolog.ops.DailyReportService.exception.RunSetupException;
import com.autolog.ops.DailyReportService.service.*;
import com.autolog.ops.DailyReportService.service.render.ReportRendererRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class DailyReportOrchestratorImpl implements DailyReportOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DailyReportOrchestratorImpl.class);

    private final OwnerScheduleSource ownerScheduleSource;
    private final OwnerReportPipeline ownerReportPipeline;
    private final ReportRendererRegistry reportRendererRegistry;
    private final CalendarWindowResolver calendarWindowResolver;
    private final RunSummaryNotifier runSummaryNotifier;
    private final DailyReportProperties dailyReportProperties;
    private final TaskExecutor ownerReportExecutor;

    public DailyReportOrchestratorImpl(OwnerScheduleSource ownerScheduleSource,
                                       OwnerReportPipeline ownerReportPipeline,
                                       ReportRendererRegistry reportRendererRegistry,
                                       CalendarWindowResolver calendarWindowResolver,
                                       RunSummaryNotifier runSummaryNotifier,
                                       DailyReportProperties dailyReportProperties,
                                       @Qualifier("ownerReportExecutor") TaskExecutor ownerReportExecutor) {
        this.ownerScheduleSource = ownerScheduleSource;
        this.ownerReportPipeline = ownerReportPipeline;
        this.reportRendererRegistry = reportRendererRegistry;
        this.calendarWindowResolver = calendarWindowResolver;
        this.runSummaryNotifier = runSummaryNotifier;
        this.dailyReportProperties = dailyReportProperties;
        this.ownerReportExecutor = ownerReportExecutor;
    }

    @Override
    public RunSummary run(ReportRunRequest request) {
        ReportRunRequest runRequest = request == null ? new ReportRunRequest() : request;
        String trigger = runRequest.getTriggerSource() == null || runRequest.getTriggerSource().isBlank()
                ? TRIGGER_MANUAL : runRequest.getTriggerSource();
        LocalDate reportDate = runRequest.getReportDate() != null ? runRequest.getReportDate() : calendarWindowResolver.today();
        LOGGER.info("Daily report run start: date {}, trigger {}", reportDate, trigger);

        List<OwnerSchedule> owners;
        try {
            owners = ownerScheduleSource.listOwners(runRequest.getOwnerIds());
        } catch (DataAccessException | TransactionException e) {
            LOGGER.error("Failed to list owners: {}", e.getMessage(), e);
            throw new RunSetupException("Failed to list owners: " + e.getMessage(), e);
        }

        List<CompletableFuture<RunResult>> futures = new ArrayList<>(owners.size());
        for (OwnerSchedule owner : owners) {
            OwnerRunContext context = buildContext(owner, runRequest, reportDate, trigger);
            futures.add(CompletableFuture
                    .supplyAsync(() -> ownerReportPipeline.process(context), ownerReportExecutor)
                    .handle((result, ex) -> ex == null ? result : failed(context, ex)));
        }
        // futures never complete exceptionally after handle
        List<RunResult> results = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());

        RunSummary summary = RunSummary.of(reportDate, trigger, results);
        LOGGER.info("Daily report run end: {} owners, {} sent, {} skipped, {} failed, revenue {}",
                summary.getTotalOwners(), summary.getSent(), summary.getSkipped(), summary.getFailed(), summary.getTotalRevenue());

        try {
            runSummaryNotifier.sendSummary(summary);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to send run summary email: {}", e.getMessage(), e);
        }
        return summary;
    }

    OwnerRunContext buildContext(OwnerSchedule owner, ReportRunRequest request, LocalDate reportDate, String trigger) {
        return OwnerRunContext.builder()
                .ownerId(owner.getOwnerId())
                .ownerName(owner.getDisplayName())
                .recipient(resolveRecipient(request.getEmail(), owner.getEmail()))
                .templateSelector(reportRendererRegistry.resolveSelector(request.getTemplateNo(), owner.getTemplateNo()))
                .timezone(firstPresent(request.getTimezone(), owner.getTimezone()))
                .locations(filterLocations(owner.getLocations(), request.getLocationIds()))
                .reportDate(reportDate)
                .triggerSource(trigger)
                .build();
    }

    /**
     * Request override, then the configured test recipient, then the owner's own address.
     */
    String resolveRecipient(String requestEmail, String ownerEmail) {
        return firstPresent(firstPresent(requestEmail, dailyReportProperties.getMail().getTestRecipient()), ownerEmail);
    }

    /**
     * Without an allowlist the owner's locations are kept as listed. With one, only allowed
     * locations remain, in allowlist order.
     */
    static List<LocationRef> filterLocations(List<LocationRef> ownerLocations, List<Long> allowlist) {
        List<LocationRef> locations = ownerLocations == null ? Collections.emptyList() : ownerLocations;
        if (allowlist == null || allowlist.isEmpty()) {
            return List.copyOf(locations);
        }
        Map<Long, LocationRef> byId = locations.stream()
                .collect(Collectors.toMap(LocationRef::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        List<LocationRef> allowed = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(allowlist)) {
            LocationRef location = byId.get(id);
            if (location != null) {
                allowed.add(location);
            }
        }
        return Collections.unmodifiableList(allowed);
    }

    private static RunResult failed(OwnerRunContext context, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        OwnerRunState state = cause instanceof DailyReportException
                ? ((DailyReportException) cause).getState()
                : OwnerRunState.FAILED;
        LOGGER.error("Report failed for owner {} ({}) at {}: {}",
                context.getOwnerId(), context.getOwnerName(), state, cause.getMessage(), cause);
        return RunResult.failed(context, state, String.valueOf(cause.getMessage()));
    }

    private static String firstPresent(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second == null || second.isBlank() ? null : second.trim();
    }
}
