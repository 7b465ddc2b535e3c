package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.ReportFixtures;
import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.RenderedReport;
import com.autolog.ops.DailyReportService.service.ReportAggregator;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.thymeleaf.TemplateEngine;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.autolog.ops.DailyReportService.ReportFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Report renderers")
class ReportRendererTest {

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};

    private TemplateEngine templateEngine;
    private DailyReportProperties properties;
    private ReportView view;
    private ReportView consolidatedView;

    @BeforeEach
    void setUp() {
        templateEngine = RenderTestSupport.templateEngine();
        properties = ReportFixtures.properties();
        ReportAggregator aggregator = new ReportAggregator();
        ReportViewFactory factory = new ReportViewFactory(ReportFixtures.CLOCK);
        view = factory.create(aggregator.aggregate(L1, threeRecordsAtL1(), IST), window(), "Anil Mehta");
        consolidatedView = factory.create(aggregator.consolidate(List.of(
                aggregator.aggregate(L1, threeRecordsAtL1(), IST),
                aggregator.aggregate(L2, List.of(record(4, L2, "300", "card", "Polish", 14)), IST))), window(), "Anil Mehta");
    }

    @Nested
    @DisplayName("template 1")
    class Classic {

        @Test
        void plainDocumentWithoutAssets() {
            RenderedReport rendered = new ClassicReportRenderer(templateEngine, new PlainTextReportWriter(), properties).render(view);

            assertThat(rendered.getSelector()).isEqualTo(1);
            assertThat(rendered.getAssets()).isEmpty();
            assertThat(rendered.getHtml()).doesNotContain("cid:");
            assertThat(rendered.getHtml()).contains("₹500.00", "Main Street", "CASH", "UPI");
            assertThat(rendered.getSubject()).isEqualTo("Daily Report - 14/03/2025 - Main Street");
        }

        @Test
        void textAlternative() {
            RenderedReport rendered = new ClassicReportRenderer(templateEngine, new PlainTextReportWriter(), properties).render(view);

            assertThat(rendered.getText())
                    .startsWith("Daily Report - 14/03/2025")
                    .contains("Total Revenue: ₹500.00")
                    .contains("CASH: ₹250.00 (2 vehicles, 50.0%)")
                    .contains("Generated on: 14/03/2025 21:00");
        }

        @Test
        @DisplayName("several locations render the location comparison")
        void consolidated() {
            RenderedReport rendered = new ClassicReportRenderer(templateEngine, new PlainTextReportWriter(), properties)
                    .render(consolidatedView);

            assertThat(rendered.getSubject()).endsWith("All Locations");
            assertThat(rendered.getHtml()).contains("Harbour Road", "Main Street", "₹800.00");
        }
    }

    @Nested
    @DisplayName("template 2")
    class Enhanced {

        @Test
        @DisplayName("every referenced content id has a png asset")
        void chartsAreEmbedded() {
            RenderedReport rendered = enhanced().render(view);

            assertThat(rendered.getAssets()).containsOnlyKeys(
                    EnhancedReportRenderer.PAYMENT_CHART_CID, EnhancedReportRenderer.HOURLY_CHART_CID);
            assertThat(rendered.getHtml())
                    .contains("cid:" + EnhancedReportRenderer.PAYMENT_CHART_CID)
                    .contains("cid:" + EnhancedReportRenderer.HOURLY_CHART_CID)
                    .doesNotContain("cid:" + AbstractThymeleafReportRenderer.LOGO_CID);
            rendered.getAssets().values().forEach(asset -> {
                assertThat(asset.getMimeType()).isEqualTo(ChartImageGenerator.PNG);
                assertThat(asset.getBytes()).startsWith(PNG_SIGNATURE);
            });
        }

        @Test
        void configuredLogoIsEmbedded() {
            properties.getTemplate().setLogo(Base64.encodeBase64String("logo".getBytes(StandardCharsets.UTF_8)));

            RenderedReport rendered = enhanced().render(view);

            assertThat(rendered.getAssets()).containsKey(AbstractThymeleafReportRenderer.LOGO_CID);
            assertThat(rendered.getAssets().get(AbstractThymeleafReportRenderer.LOGO_CID).getBytes())
                    .isEqualTo("logo".getBytes(StandardCharsets.UTF_8));
            assertThat(rendered.getHtml()).contains("cid:" + AbstractThymeleafReportRenderer.LOGO_CID);
        }

        private EnhancedReportRenderer enhanced() {
            return new EnhancedReportRenderer(templateEngine, new PlainTextReportWriter(), properties, new ChartImageGenerator());
        }
    }

    @Nested
    @DisplayName("template 3")
    class Insights {

        @Test
        void businessIntelligenceLayout() {
            RenderedReport rendered = new InsightsReportRenderer(templateEngine, new PlainTextReportWriter(), properties,
                    new ChartImageGenerator()).render(view);

            assertThat(rendered.getSubject()).isEqualTo("Business Intelligence Report - 14/03/2025 - Main Street");
            assertThat(rendered.getAssets()).containsOnlyKeys(
                    InsightsReportRenderer.TREND_CHART_CID, InsightsReportRenderer.SERVICE_CHART_CID);
            assertThat(rendered.getHtml()).contains("11:00 AM", "cid:trend-chart", "cid:service-chart");
            assertThat(rendered.getText()).contains("(2 transactions");
        }
    }

    @Test
    void contentIdToVariableName() {
        assertThat(AbstractThymeleafReportRenderer.cidVariable("hourly-chart")).isEqualTo("hourlyChartCid");
        assertThat(AbstractThymeleafReportRenderer.cidVariable("brand-logo")).isEqualTo("brandLogoCid");
    }
}
