package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.InlineAsset;
import com.autolog.ops.DailyReportService.dto.report.RenderedReport;
import com.autolog.ops.DailyReportService.exception.RenderException;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public abstract class AbstractThymeleafReportRenderer implements ReportRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractThymeleafReportRenderer.class);

    public static final String LOGO_CID = "brand-logo";

    private final TemplateEngine templateEngine;
    private final PlainTextReportWriter plainTextReportWriter;
    private final DailyReportProperties dailyReportProperties;

    protected AbstractThymeleafReportRenderer(TemplateEngine templateEngine, PlainTextReportWriter plainTextReportWriter,
                                              DailyReportProperties dailyReportProperties) {
        this.templateEngine = templateEngine;
        this.plainTextReportWriter = plainTextReportWriter;
        this.dailyReportProperties = dailyReportProperties;
    }

    protected abstract String templateName();

    protected abstract String title();

    /** Word used for transaction counts in the text body. */
    protected String unitLabel() {
        return "vehicles";
    }

    /** Inline assets of this layout, keyed by content id. */
    protected Map<String, InlineAsset> assets(ReportView view) {
        return Collections.emptyMap();
    }

    protected boolean embedsLogo() {
        return false;
    }

    @Override
    public RenderedReport render(ReportView view) {
        Map<String, InlineAsset> assets = new LinkedHashMap<>();
        if (embedsLogo()) {
            InlineAsset logo = logo();
            if (logo != null) {
                assets.put(logo.getContentId(), logo);
            }
        }
        assets.putAll(assets(view));

        Map<String, Object> props = new HashMap<>();
        props.put("report", view);
        props.put("title", title());
        props.put("logoCid", assets.containsKey(LOGO_CID) ? LOGO_CID : null);
        assets.keySet().forEach(cid -> props.put(cidVariable(cid), cid));

        String html;
        try {
            Context context = new Context();
            context.setVariables(props);
            html = templateEngine.process(templateName(), context);
        } catch (TemplateEngineException e) {
            LOGGER.error("Template {} failed to render: {}", templateName(), e.getMessage(), e);
            throw new RenderException("Template " + templateName() + " failed to render: " + e.getMessage(), e);
        }
        String text = plainTextReportWriter.write(title(), view, unitLabel());
        String subject = title() + " - " + view.getReportDate() + " - " + view.getLocationLabel();
        return new RenderedReport(getSelector(), subject, html, text, Collections.unmodifiableMap(assets));
    }

    /** {@code hourly-chart} becomes template variable {@code hourlyChartCid}. */
    static String cidVariable(String contentId) {
        StringBuilder name = new StringBuilder();
        boolean upper = false;
        for (char c : contentId.toCharArray()) {
            if (c == '-') {
                upper = true;
            } else {
                name.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return name.append("Cid").toString();
    }

    private InlineAsset logo() {
        String encoded = dailyReportProperties.getTemplate().getLogo();
        if (encoded == null || encoded.isBlank()) {
            return null;
        }
        return new InlineAsset(LOGO_CID, Base64.decodeBase64(encoded), ChartImageGenerator.PNG);
    }
}
