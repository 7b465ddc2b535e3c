package com.autolog.ops.DailyReportService.service.render;

import org.springframework.stereotype.Component;

/**
 * Plain-text alternative of a report body.
 */
@Component
public class PlainTextReportWriter {

    public String write(String title, ReportView view, String unitLabel) {
        StringBuilder text = new StringBuilder();
        text.append(title).append(" - ").append(view.getReportDate()).append("\n\n");
        text.append("Location: ").append(view.getLocationLabel()).append('\n');
        text.append("Total Revenue: ").append(view.getTotalRevenue()).append('\n');
        text.append("Transactions: ").append(view.getTransactionCount()).append('\n');
        text.append("Average Ticket: ").append(view.getAverageTicket()).append("\n\n");

        if (view.isConsolidated()) {
            text.append("LOCATIONS:\n");
            for (ReportView.LocationRow location : view.getLocations()) {
                text.append(location.getName()).append(": ").append(location.getAmount())
                        .append(" (").append(location.getCount()).append(' ').append(unitLabel)
                        .append(", ").append(location.getShare()).append(")\n");
            }
            text.append('\n');
        }

        text.append("PAYMENT BREAKDOWN:\n");
        for (ReportView.BreakdownRow row : view.getPayments()) {
            text.append(row.getLabel()).append(": ").append(row.getAmount())
                    .append(" (").append(row.getCount()).append(' ').append(unitLabel)
                    .append(", ").append(row.getShare()).append(")\n");
            if (row.hasDetails()) {
                for (String detail : row.getDetails()) {
                    text.append("  - ").append(detail).append('\n');
                }
            }
        }

        text.append("\nSERVICE BREAKDOWN:\n");
        for (ReportView.BreakdownRow row : view.getServices()) {
            text.append(row.getLabel()).append(": ").append(row.getCount()).append(' ').append(unitLabel)
                    .append(", ").append(row.getAmount()).append(" revenue (avg ").append(row.getAverage()).append(")\n");
        }

        text.append("\nGenerated on: ").append(view.getGeneratedAt()).append('\n');
        return text.toString();
    }
}
