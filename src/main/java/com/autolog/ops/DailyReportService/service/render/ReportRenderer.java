package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.dto.report.RenderedReport;

/**
 * One report layout. Every variant returns the same shape: html and text bodies plus the inline
 * assets the html references by content id.
 */
public interface ReportRenderer {

    int getSelector();

    RenderedReport render(ReportView view);
}
