package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.InlineAsset;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;

import java.awt.Color;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Template 2: card layout with payment-mix and hourly charts embedded inline.
 */
@Component
public class EnhancedReportRenderer extends AbstractThymeleafReportRenderer {

    public static final String PAYMENT_CHART_CID = "payment-chart";
    public static final String HOURLY_CHART_CID = "hourly-chart";

    private final ChartImageGenerator chartImageGenerator;

    public EnhancedReportRenderer(TemplateEngine templateEngine, PlainTextReportWriter plainTextReportWriter,
                                  DailyReportProperties dailyReportProperties, ChartImageGenerator chartImageGenerator) {
        super(templateEngine, plainTextReportWriter, dailyReportProperties);
        this.chartImageGenerator = chartImageGenerator;
    }

    @Override
    public int getSelector() {
        return 2;
    }

    @Override
    protected String templateName() {
        return "daily_report_enhanced";
    }

    @Override
    protected String title() {
        return "Daily Report";
    }

    @Override
    protected boolean embedsLogo() {
        return true;
    }

    @Override
    protected Map<String, InlineAsset> assets(ReportView view) {
        Map<String, InlineAsset> assets = new LinkedHashMap<>();
        assets.put(PAYMENT_CHART_CID, new InlineAsset(PAYMENT_CHART_CID,
                chartImageGenerator.barChart(view.getPaymentSeries(), new Color(0x66, 0x7E, 0xEA), new Color(0x76, 0x4B, 0xA2), 560, 220),
                ChartImageGenerator.PNG));
        assets.put(HOURLY_CHART_CID, new InlineAsset(HOURLY_CHART_CID,
                chartImageGenerator.barChart(view.getHourlySeries(), new Color(0x4F, 0xAC, 0xFE), new Color(0x00, 0xF2, 0xFE), 720, 220),
                ChartImageGenerator.PNG));
        return assets;
    }
}
