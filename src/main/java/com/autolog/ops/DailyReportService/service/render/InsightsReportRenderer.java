package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.InlineAsset;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;

import java.awt.Color;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Template 3: business-intelligence layout with hourly trend and service revenue charts.
 */
@Component
public class InsightsReportRenderer extends AbstractThymeleafReportRenderer {

    public static final String TREND_CHART_CID = "trend-chart";
    public static final String SERVICE_CHART_CID = "service-chart";

    private final ChartImageGenerator chartImageGenerator;

    public InsightsReportRenderer(TemplateEngine templateEngine, PlainTextReportWriter plainTextReportWriter,
                                  DailyReportProperties dailyReportProperties, ChartImageGenerator chartImageGenerator) {
        super(templateEngine, plainTextReportWriter, dailyReportProperties);
        this.chartImageGenerator = chartImageGenerator;
    }

    @Override
    public int getSelector() {
        return 3;
    }

    @Override
    protected String templateName() {
        return "daily_report_insights";
    }

    @Override
    protected String title() {
        return "Business Intelligence Report";
    }

    @Override
    protected String unitLabel() {
        return "transactions";
    }

    @Override
    protected boolean embedsLogo() {
        return true;
    }

    @Override
    protected Map<String, InlineAsset> assets(ReportView view) {
        Map<String, InlineAsset> assets = new LinkedHashMap<>();
        assets.put(TREND_CHART_CID, new InlineAsset(TREND_CHART_CID,
                chartImageGenerator.barChart(view.getHourlySeries(), new Color(0x43, 0xE9, 0x7B), new Color(0x38, 0xF9, 0xD7), 720, 240),
                ChartImageGenerator.PNG));
        assets.put(SERVICE_CHART_CID, new InlineAsset(SERVICE_CHART_CID,
                chartImageGenerator.barChart(view.getServiceSeries(), new Color(0xFA, 0x70, 0x9A), new Color(0xFE, 0xE1, 0x40), 560, 240),
                ChartImageGenerator.PNG));
        return assets;
    }
}
