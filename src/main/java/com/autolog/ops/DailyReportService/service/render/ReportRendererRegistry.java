package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.exception.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class ReportRendererRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportRendererRegistry.class);

    private final Map<Integer, ReportRenderer> renderers = new TreeMap<>();
    private final DailyReportProperties dailyReportProperties;

    public ReportRendererRegistry(List<ReportRenderer> renderers, DailyReportProperties dailyReportProperties) {
        for (ReportRenderer renderer : renderers) {
            ReportRenderer previous = this.renderers.put(renderer.getSelector(), renderer);
            if (previous != null) {
                throw new IllegalStateException("Two renderers registered for template " + renderer.getSelector());
            }
        }
        this.dailyReportProperties = dailyReportProperties;
        LOGGER.info("Report templates available: {}", this.renderers.keySet());
    }

    /**
     * Request override, then the owner's stored preference, then the configured default.
     */
    public int resolveSelector(Integer requestOverride, Integer ownerPreference) {
        if (requestOverride != null) {
            return requestOverride;
        }
        if (ownerPreference != null) {
            return ownerPreference;
        }
        return dailyReportProperties.getTemplate().getDefaultTemplate();
    }

    public ReportRenderer get(int selector) {
        ReportRenderer renderer = renderers.get(selector);
        if (renderer == null) {
            throw new RenderException("Unsupported template selector " + selector + "; expected one of " + renderers.keySet());
        }
        return renderer;
    }
}
