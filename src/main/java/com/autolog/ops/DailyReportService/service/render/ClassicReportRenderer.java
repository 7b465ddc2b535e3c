package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;

/**
 * Template 1: table layout, no embedded images.
 */
@Component
public class ClassicReportRenderer extends AbstractThymeleafReportRenderer {

    public ClassicReportRenderer(TemplateEngine templateEngine, PlainTextReportWriter plainTextReportWriter,
                                 DailyReportProperties dailyReportProperties) {
        super(templateEngine, plainTextReportWriter, dailyReportProperties);
    }

    @Override
    public int getSelector() {
        return 1;
    }

    @Override
    protected String templateName() {
        return "daily_report_classic";
    }

    @Override
    protected String title() {
        return "Daily Report";
    }
}
