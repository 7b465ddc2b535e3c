package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.*;
import com.autolog.ops.DailyReportService.dto.requestDto.MailDto;
import com.autolog.ops.DailyReportService.dto.responseDto.RunResult;
import com.autolog.ops.DailyReportService.enums.OwnerRunState;
import com.autolog.ops.DailyReportService.exception.DailyReportException;
import com.autolog.ops.DailyReportService.exception.PipelineStageException;
import com.autolog.ops.DailyReportService.service.render.ReportRenderer;
import com.autolog.ops.DailyReportService.service.render.ReportRendererRegistry;
import com.autolog.ops.DailyReportService.service.render.ReportView;
import com.autolog.ops.DailyReportService.service.render.ReportViewFactory;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

import static com.autolog.ops.DailyReportService.util.EmailServiceUtils.commaSeparatedStringToArray;
import static com.autolog.ops.DailyReportService.util.EmailServiceUtils.hasAddress;

/**
 * Runs one owner through fetch, aggregate, render, compose and send. Stages run strictly in
 * sequence; every failure surfaces as a {@link DailyReportException} carrying the stage that
 * was running.
 */
@Component
public class OwnerReportPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(OwnerReportPipeline.class);

    private final CalendarWindowResolver calendarWindowResolver;
    private final TransactionFetcher transactionFetcher;
    private final ReportAggregator reportAggregator;
    private final ReportViewFactory reportViewFactory;
    private final ReportRendererRegistry reportRendererRegistry;
    private final AttachmentBuilder attachmentBuilder;
    private final DeliveryComposer deliveryComposer;
    private final EmailSender emailSender;
    private final DailyReportProperties dailyReportProperties;

    public OwnerReportPipeline(CalendarWindowResolver calendarWindowResolver,
                               TransactionFetcher transactionFetcher,
                               ReportAggregator reportAggregator,
                               ReportViewFactory reportViewFactory,
                               ReportRendererRegistry reportRendererRegistry,
                               AttachmentBuilder attachmentBuilder,
                               DeliveryComposer deliveryComposer,
                               EmailSender emailSender,
                               DailyReportProperties dailyReportProperties) {
        this.calendarWindowResolver = calendarWindowResolver;
        this.transactionFetcher = transactionFetcher;
        this.reportAggregator = reportAggregator;
        this.reportViewFactory = reportViewFactory;
        this.reportRendererRegistry = reportRendererRegistry;
        this.attachmentBuilder = attachmentBuilder;
        this.deliveryComposer = deliveryComposer;
        this.emailSender = emailSender;
        this.dailyReportProperties = dailyReportProperties;
    }

    public RunResult process(OwnerRunContext context) {
        if (!hasAddress(context.getRecipient())) {
            LOGGER.warn("Skipping owner {} ({}): no email", context.getOwnerId(), context.getOwnerName());
            return RunResult.skipped(context, RunResult.NO_RECIPIENT);
        }
        if (context.getLocations() == null || context.getLocations().isEmpty()) {
            LOGGER.warn("Skipping owner {} ({}): no locations to report", context.getOwnerId(), context.getOwnerName());
            return RunResult.skipped(context, RunResult.NO_DATA);
        }

        OwnerRunState stage = OwnerRunState.PENDING;
        try {
            ReportWindow window = calendarWindowResolver.resolve(context.getReportDate(), context.getTimezone());

            stage = OwnerRunState.FETCHING;
            List<Long> locationIds = context.getLocations().stream().map(LocationRef::getId).collect(Collectors.toList());
            LOGGER.info("Processing owner {} ({}) for {} locations {}, template {}",
                    context.getOwnerId(), context.getOwnerName(), locationIds.size(), locationIds, context.getTemplateSelector());
            List<TransactionRecord> records = transactionFetcher.fetch(locationIds, window, null);
            if (records.isEmpty()) {
                LOGGER.info("Skipping owner {} ({}): no approved transactions on {}",
                        context.getOwnerId(), context.getOwnerName(), window.getDate());
                return RunResult.skipped(context, RunResult.NO_DATA);
            }

            stage = OwnerRunState.AGGREGATING;
            ReportSummary summary = summarize(context.getLocations(), records, window);

            stage = OwnerRunState.RENDERING;
            // unknown selector fails here, before any template work
            ReportRenderer renderer = reportRendererRegistry.get(context.getTemplateSelector());
            ReportView view = reportViewFactory.create(summary, window, context.getOwnerName());
            RenderedReport rendered = renderer.render(view);
            List<CsvAttachment> attachments = attachmentBuilder.build(summary, window);

            stage = OwnerRunState.SENDING;
            MailDto mailDto = new MailDto();
            mailDto.setFrom(dailyReportProperties.getMail().getFrom());
            mailDto.setTo(commaSeparatedStringToArray(context.getRecipient()));
            mailDto.setSubject(rendered.getSubject());
            MimeMessage message = deliveryComposer.compose(mailDto, rendered, attachments);
            emailSender.send(message);

            LOGGER.info("Report sent to {} for owner {}: {} records, revenue {}",
                    context.getRecipient(), context.getOwnerId(), summary.getCount(), summary.getTotal());
            return RunResult.sent(context, summary.getCount(), summary.getTotal());
        } catch (DailyReportException e) {
            throw e;
        } catch (RuntimeException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new PipelineStageException(stage, "Failed while " + stage.name().toLowerCase(Locale.ROOT) + ": " + reason, e);
        }
    }

    /**
     * One location yields its own summary; several are merged in the context's location order.
     */
    ReportSummary summarize(List<LocationRef> locations, List<TransactionRecord> records, ReportWindow window) {
        Map<Long, List<TransactionRecord>> byLocation = new HashMap<>();
        for (TransactionRecord record : records) {
            byLocation.computeIfAbsent(record.getLocationId(), id -> new ArrayList<>()).add(record);
        }
        List<LocationSummary> summaries = new ArrayList<>(locations.size());
        for (LocationRef location : locations) {
            summaries.add(reportAggregator.aggregate(location,
                    byLocation.getOrDefault(location.getId(), Collections.emptyList()), window.getOffset()));
        }
        if (summaries.size() == 1) {
            return summaries.get(0);
        }
        return reportAggregator.consolidate(summaries);
    }
}
