package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.ReportFixtures;
import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.exception.RenderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.thymeleaf.TemplateEngine;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportRendererRegistryTest {

    private DailyReportProperties properties;
    private ReportRendererRegistry registry;

    @BeforeEach
    void setUp() {
        properties = ReportFixtures.properties();
        TemplateEngine engine = RenderTestSupport.templateEngine();
        PlainTextReportWriter writer = new PlainTextReportWriter();
        ChartImageGenerator charts = new ChartImageGenerator();
        registry = new ReportRendererRegistry(List.of(
                new InsightsReportRenderer(engine, writer, properties, charts),
                new ClassicReportRenderer(engine, writer, properties),
                new EnhancedReportRenderer(engine, writer, properties, charts)), properties);
    }

    @Test
    void requestOverrideThenOwnerThenDefault() {
        assertThat(registry.resolveSelector(3, 2)).isEqualTo(3);
        assertThat(registry.resolveSelector(null, 2)).isEqualTo(2);
        assertThat(registry.resolveSelector(null, null)).isEqualTo(1);

        properties.getTemplate().setDefaultTemplate(2);
        assertThat(registry.resolveSelector(null, null)).isEqualTo(2);
    }

    @Test
    void looksUpBySelector() {
        assertThat(registry.get(1)).isInstanceOf(ClassicReportRenderer.class);
        assertThat(registry.get(2)).isInstanceOf(EnhancedReportRenderer.class);
        assertThat(registry.get(3)).isInstanceOf(InsightsReportRenderer.class);
    }

    @Test
    void unknownSelectorIsRenderError() {
        assertThatThrownBy(() -> registry.get(7))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("7");
    }

    @Test
    void duplicateSelectorsAreRejected() {
        TemplateEngine engine = RenderTestSupport.templateEngine();
        PlainTextReportWriter writer = new PlainTextReportWriter();

        assertThatThrownBy(() -> new ReportRendererRegistry(List.of(
                new ClassicReportRenderer(engine, writer, properties),
                new ClassicReportRenderer(engine, writer, properties)), properties))
                .isInstanceOf(IllegalStateException.class);
    }
}
