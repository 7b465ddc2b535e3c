package com.autolog.ops.DailyReportService.service.impl;

import com.autolog.ops.DailyReportService.ReportFixtures;
import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.LocationRef;
import com.autolog.ops.DailyReportService.dto.report.OwnerRunContext;
import com.autolog.ops.DailyReportService.dto.report.OwnerSchedule;
import com.autolog.ops.DailyReportService.dto.requestDto.ReportRunRequest;
import com.autolog.ops.DailyReportService.dto.responseDto.RunResult;
import com.autolog.ops.DailyReportService.dto.responseDto.RunSummary;
import com.autolog.ops.DailyReportService.enums.OwnerRunState;
import com.autolog.ops.DailyReportService.enums.RunStatus;
import com.autolog.ops.DailyReportService.exception.FetchException;
import com.autolog.ops.DailyReportService.exception.InvalidTimezoneException;
import com.autolog.ops.DailyReportService.exception.RunSetupException;
import com.autolog.ops.DailyReportService.service.CalendarWindowResolver;
import com.autolog.ops.DailyReportService.service.DailyReportOrchestrator;
import com.autolog.ops.DailyReportService.service.OwnerReportPipeline;
import com.autolog.ops.DailyReportService.service.OwnerScheduleSource;
import com.autolog.ops.DailyReportService.service.RunSummaryNotifier;
import com.autolog.ops.DailyReportService.service.render.ReportRendererRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.autolog.ops.DailyReportService.ReportFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DailyReportOrchestratorImpl")
class DailyReportOrchestratorImplTest {

    @Mock
    private OwnerScheduleSource ownerScheduleSource;

    @Mock
    private OwnerReportPipeline ownerReportPipeline;

    @Mock
    private RunSummaryNotifier runSummaryNotifier;

    private DailyReportProperties properties;

    @BeforeEach
    void setUp() {
        properties = ReportFixtures.properties();
    }

    private DailyReportOrchestratorImpl orchestrator(TaskExecutor executor) {
        return new DailyReportOrchestratorImpl(ownerScheduleSource, ownerReportPipeline,
                new ReportRendererRegistry(List.of(), properties),
                new CalendarWindowResolver(properties, CLOCK),
                runSummaryNotifier, properties, executor);
    }

    @Nested
    @DisplayName("per-owner isolation")
    class Isolation {

        @Test
        @DisplayName("one owner's failure does not stop the others")
        void failureIsRecordedAndRunContinues() {
            when(ownerScheduleSource.listOwners(any())).thenReturn(List.of(owner(1L), owner(2L), owner(3L)));
            when(ownerReportPipeline.process(any())).thenAnswer(invocation -> {
                OwnerRunContext context = invocation.getArgument(0);
                if (context.getOwnerId() == 2L) {
                    throw new FetchException("Failed to fetch data: timeout");
                }
                if (context.getOwnerId() == 3L) {
                    return RunResult.skipped(context, RunResult.NO_DATA);
                }
                return RunResult.sent(context, 3, new BigDecimal("500.00"));
            });

            RunSummary summary = orchestrator(new SyncTaskExecutor()).run(new ReportRunRequest());

            assertThat(summary.getTotalOwners()).isEqualTo(3);
            assertThat(summary.getSent()).isEqualTo(1);
            assertThat(summary.getFailed()).isEqualTo(1);
            assertThat(summary.getSkipped()).isEqualTo(1);
            assertThat(summary.getTotalRevenue()).isEqualByComparingTo("500");
            assertThat(summary.getTotalRecords()).isEqualTo(3);
            RunResult failed = summary.getResults().get(1);
            assertThat(failed.getOwnerId()).isEqualTo(2L);
            assertThat(failed.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(failed.getLastState()).isEqualTo(OwnerRunState.FETCHING);
            assertThat(failed.getReason()).isEqualTo("Failed to fetch data: timeout");
        }

        @Test
        void invalidTimezoneFailsOnlyThatOwner() {
            when(ownerScheduleSource.listOwners(any())).thenReturn(List.of(owner(1L), owner(2L)));
            when(ownerReportPipeline.process(any())).thenAnswer(invocation -> {
                OwnerRunContext context = invocation.getArgument(0);
                if (context.getOwnerId() == 1L) {
                    throw new InvalidTimezoneException("Cannot resolve timezone 'Mars/Olympus' to a UTC offset");
                }
                return RunResult.sent(context, 1, BigDecimal.TEN);
            });

            RunSummary summary = orchestrator(new SyncTaskExecutor()).run(new ReportRunRequest());

            assertThat(summary.getResults()).extracting(RunResult::getStatus)
                    .containsExactly(RunStatus.FAILED, RunStatus.SENT);
            assertThat(summary.getResults().get(0).getLastState()).isEqualTo(OwnerRunState.PENDING);
        }

        @Test
        @DisplayName("results keep owner order when owners run concurrently")
        void concurrentRunKeepsOwnerOrder() {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(4);
            executor.initialize();
            try {
                when(ownerScheduleSource.listOwners(any())).thenReturn(List.of(owner(1L), owner(2L), owner(3L), owner(4L)));
                when(ownerReportPipeline.process(any())).thenAnswer(invocation -> {
                    OwnerRunContext context = invocation.getArgument(0);
                    Thread.sleep(50 - context.getOwnerId() * 10);
                    return RunResult.sent(context, context.getOwnerId(), BigDecimal.ONE);
                });

                RunSummary summary = orchestrator(executor).run(new ReportRunRequest());

                assertThat(summary.getResults()).extracting(RunResult::getOwnerId).containsExactly(1L, 2L, 3L, 4L);
                assertThat(summary.getTotalRecords()).isEqualTo(10);
            } finally {
                executor.shutdown();
            }
        }

        @Test
        void ownerListingFailureIsRunSetupFailure() {
            when(ownerScheduleSource.listOwners(any())).thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatThrownBy(() -> orchestrator(new SyncTaskExecutor()).run(new ReportRunRequest()))
                    .isInstanceOf(RunSetupException.class)
                    .hasMessageContaining("db down");
            verifyNoInteractions(ownerReportPipeline, runSummaryNotifier);
        }

        @Test
        void summaryEmailFailureDoesNotChangeTheResult() {
            when(ownerScheduleSource.listOwners(any())).thenReturn(List.of(owner(1L)));
            when(ownerReportPipeline.process(any())).thenAnswer(invocation ->
                    RunResult.sent(invocation.getArgument(0), 1, BigDecimal.ONE));
            when(runSummaryNotifier.sendSummary(any())).thenThrow(new IllegalStateException("smtp down"));

            RunSummary summary = orchestrator(new SyncTaskExecutor()).run(new ReportRunRequest());

            assertThat(summary.getSent()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("context resolution")
    class ContextResolution {

        @Test
        void requestOverridesWin() {
            when(ownerScheduleSource.listOwners(List.of(1L))).thenReturn(List.of(owner(1L)));
            when(ownerReportPipeline.process(any())).thenAnswer(invocation -> RunResult.skipped(invocation.getArgument(0), RunResult.NO_DATA));
            ReportRunRequest request = ReportRunRequest.builder()
                    .ownerIds(List.of(1L))
                    .email("qa@autolog.test")
                    .templateNo(3)
                    .timezone("+04:00")
                    .locationIds(List.of(2L))
                    .reportDate(LocalDate.of(2025, 1, 2))
                    .triggerSource("ADMIN_PANEL")
                    .build();

            RunSummary summary = orchestrator(new SyncTaskExecutor()).run(request);

            OwnerRunContext context = capturedContext();
            assertThat(context.getRecipient()).isEqualTo("qa@autolog.test");
            assertThat(context.getTemplateSelector()).isEqualTo(3);
            assertThat(context.getTimezone()).isEqualTo("+04:00");
            assertThat(context.getLocations()).extracting(LocationRef::getId).containsExactly(2L);
            assertThat(context.getReportDate()).isEqualTo(LocalDate.of(2025, 1, 2));
            assertThat(summary.getTriggerSource()).isEqualTo("ADMIN_PANEL");
        }

        @Test
        void ownerPreferencesApplyWithoutOverrides() {
            when(ownerScheduleSource.listOwners(any())).thenReturn(List.of(owner(1L)));
            when(ownerReportPipeline.process(any())).thenAnswer(invocation -> RunResult.skipped(invocation.getArgument(0), RunResult.NO_DATA));

            RunSummary summary = orchestrator(new SyncTaskExecutor()).run(null);

            OwnerRunContext context = capturedContext();
            assertThat(context.getRecipient()).isEqualTo("owner1@autolog.test");
            assertThat(context.getTemplateSelector()).isEqualTo(2);
            assertThat(context.getTimezone()).isEqualTo("Asia/Dubai");
            assertThat(context.getLocations()).extracting(LocationRef::getId).containsExactly(1L, 2L);
            assertThat(context.getReportDate()).isEqualTo(DAY);
            assertThat(summary.getTriggerSource()).isEqualTo(DailyReportOrchestrator.TRIGGER_MANUAL);
        }

        @Test
        void testRecipientSitsBetweenRequestAndOwner() {
            properties.getMail().setTestRecipient("inbox@autolog.test");
            DailyReportOrchestratorImpl orchestrator = orchestrator(new SyncTaskExecutor());

            assertThat(orchestrator.resolveRecipient(null, "owner@autolog.test")).isEqualTo("inbox@autolog.test");
            assertThat(orchestrator.resolveRecipient("qa@autolog.test", "owner@autolog.test")).isEqualTo("qa@autolog.test");
        }

        @Test
        @DisplayName("an allowlist that excludes every location leaves none")
        void allowlistFiltering() {
            List<LocationRef> owned = List.of(L1, L2);

            assertThat(DailyReportOrchestratorImpl.filterLocations(owned, List.of(2L, 1L)))
                    .extracting(LocationRef::getId).containsExactly(2L, 1L);
            assertThat(DailyReportOrchestratorImpl.filterLocations(owned, List.of(99L))).isEmpty();
            assertThat(DailyReportOrchestratorImpl.filterLocations(owned, null)).containsExactly(L1, L2);
        }

        private OwnerRunContext capturedContext() {
            ArgumentCaptor<OwnerRunContext> context = ArgumentCaptor.forClass(OwnerRunContext.class);
            verify(ownerReportPipeline).process(context.capture());
            return context.getValue();
        }
    }

    private static OwnerSchedule owner(Long id) {
        return OwnerSchedule.builder()
                .ownerId(id)
                .displayName("Owner " + id)
                .email("owner" + id + "@autolog.test")
                .templateNo(2)
                .timezone("Asia/Dubai")
                .locations(List.of(L1, L2))
                .build();
    }
}
