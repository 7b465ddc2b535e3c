package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.RenderedReport;
import com.autolog.ops.DailyReportService.dto.requestDto.MailDto;
import com.autolog.ops.DailyReportService.dto.responseDto.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.autolog.ops.DailyReportService.util.EmailServiceUtils.commaSeparatedStringToArray;
import static com.autolog.ops.DailyReportService.util.EmailServiceUtils.hasAddress;
import static com.autolog.ops.DailyReportService.util.ReportFormatUtils.DISPLAY_DATE;
import static com.autolog.ops.DailyReportService.util.ReportFormatUtils.currency;

/**
 * Mails the run summary to the summary recipient, or to the sender when none is configured.
 */
@Component
public class RunSummaryNotifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunSummaryNotifier.class);

    static final String TEMPLATE = "run_summary";

    private final TemplateEngine templateEngine;
    private final DeliveryComposer deliveryComposer;
    private final EmailSender emailSender;
    private final DailyReportProperties dailyReportProperties;

    public RunSummaryNotifier(TemplateEngine templateEngine, DeliveryComposer deliveryComposer,
                              EmailSender emailSender, DailyReportProperties dailyReportProperties) {
        this.templateEngine = templateEngine;
        this.deliveryComposer = deliveryComposer;
        this.emailSender = emailSender;
        this.dailyReportProperties = dailyReportProperties;
    }

    /**
     * @return {@code true} when a summary email was sent
     */
    public boolean sendSummary(RunSummary summary) {
        DailyReportProperties.Mail mail = dailyReportProperties.getMail();
        if (!mail.isSummaryEnabled()) {
            return false;
        }
        String recipient = hasAddress(mail.getSummaryRecipient()) ? mail.getSummaryRecipient() : mail.getFrom();
        if (!hasAddress(recipient)) {
            LOGGER.warn("Run summary not sent: no summary recipient or sender configured");
            return false;
        }

        String reportDate = summary.getReportDate().format(DISPLAY_DATE);
        Map<String, Object> props = new HashMap<>();
        props.put("summary", summary);
        props.put("reportDate", reportDate);
        props.put("totalRevenue", currency(summary.getTotalRevenue()));
        Context context = new Context();
        context.setVariables(props);
        String html = templateEngine.process(TEMPLATE, context);

        String subject = "Daily Report Summary - " + reportDate;
        String text = subject + "\n\nOwners: " + summary.getTotalOwners()
                + "\nSent: " + summary.getSent()
                + "\nSkipped: " + summary.getSkipped()
                + "\nFailed: " + summary.getFailed()
                + "\nRecords: " + summary.getTotalRecords()
                + "\nRevenue: " + currency(summary.getTotalRevenue()) + "\n";

        MailDto mailDto = new MailDto();
        mailDto.setFrom(mail.getFrom());
        mailDto.setTo(commaSeparatedStringToArray(recipient));
        mailDto.setSubject(subject);
        emailSender.send(deliveryComposer.compose(mailDto,
                new RenderedReport(0, subject, html, text, Collections.emptyMap()), Collections.emptyList()));
        LOGGER.info("Run summary sent to {}", recipient);
        return true;
    }
}
