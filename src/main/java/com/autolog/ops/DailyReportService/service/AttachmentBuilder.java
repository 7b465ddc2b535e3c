package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.dto.report.*;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Collectors;

import static com.autolog.ops.DailyReportService.util.ReportFormatUtils.*;

/**
 * Builds the CSV attachments of a report: transaction detail, payment-mode breakdown and
 * service breakdown. A payload with no rows is left out.
 */
@Component
public class AttachmentBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(AttachmentBuilder.class);

    public static final String CONSOLIDATED_TOKEN = "consolidated";

    static final String[] DETAIL_HEADER = {
            "Vehicle Number", "Owner Name", "Phone", "Vehicle Model", "Service Type", "Price",
            "Payment Mode", "UPI Account", "Entry Type", "Date", "Location"
    };
    static final String[] PAYMENT_HEADER = {
            "Payment Mode", "Total Revenue", "Vehicle Count", "Percentage of Total", "UPI Accounts"
    };
    static final String[] SERVICE_HEADER = {
            "Service Type", "Total Revenue", "Vehicle Count", "Average Price", "Percentage of Revenue"
    };

    public List<CsvAttachment> build(ReportSummary summary, ReportWindow window) {
        String token = locationToken(summary);
        String date = window.getDate().format(FILE_DATE);
        List<CsvAttachment> attachments = new ArrayList<>(3);
        if (!summary.getRows().isEmpty()) {
            attachments.add(new CsvAttachment("report_" + date + "_" + token + ".csv", detailCsv(summary, window.getOffset())));
        }
        if (!summary.getPaymentModes().isEmpty()) {
            attachments.add(new CsvAttachment("payment_" + date + "_" + token + ".csv", paymentCsv(summary)));
        }
        if (!summary.getServices().isEmpty()) {
            attachments.add(new CsvAttachment("service_" + date + "_" + token + ".csv", serviceCsv(summary)));
        }
        LOGGER.debug("Built {} attachments for token {} on {}", attachments.size(), token, date);
        return attachments;
    }

    /** {@code consolidated} for several locations, otherwise the location name slug. */
    public String locationToken(ReportSummary summary) {
        List<LocationSummary> locations = summary.getLocations();
        if (locations.size() != 1) {
            return CONSOLIDATED_TOKEN;
        }
        LocationSummary location = locations.get(0);
        return location.getLocationName() == null || location.getLocationName().isBlank()
                ? "location-" + location.getLocationId()
                : slug(location.getLocationName());
    }

    public String detailCsv(ReportSummary summary, ZoneOffset offset) {
        Map<Long, String> locationNames = new HashMap<>();
        for (LocationSummary location : summary.getLocations()) {
            locationNames.put(location.getLocationId(), location.getLocationName());
        }
        List<String[]> lines = new ArrayList<>();
        lines.add(DETAIL_HEADER);
        for (TransactionRecord record : summary.getRows()) {
            OwnerInfo owner = record.getOwner() == null ? OwnerInfo.UNKNOWN : record.getOwner();
            VehicleInfo vehicle = record.getVehicle() == null ? VehicleInfo.UNKNOWN : record.getVehicle();
            lines.add(new String[]{
                    orEmpty(vehicle.getPlateNumber()),
                    orEmpty(owner.getName()),
                    orEmpty(owner.getContact()),
                    orEmpty(vehicle.getModelName()),
                    orEmpty(record.getService()),
                    plainAmount(record.getAmount()),
                    orEmpty(record.getPaymentMode()),
                    orEmpty(record.getPayerName()),
                    orEmpty(record.getEntryType()),
                    record.getCreatedAt() == null ? "" : record.getCreatedAt().atOffset(offset).format(DISPLAY_DATE_TIME),
                    Objects.toString(locationNames.get(record.getLocationId()), "Unknown")
            });
        }
        return write(lines);
    }

    public String paymentCsv(ReportSummary summary) {
        List<String[]> lines = new ArrayList<>();
        lines.add(PAYMENT_HEADER);
        for (BreakdownEntry entry : summary.getPaymentModes()) {
            lines.add(new String[]{
                    entry.getLabel(),
                    plainAmount(entry.getAmount()),
                    String.valueOf(entry.getCount()),
                    percent(entry.getAmount(), summary.getTotal()),
                    payerDetail(entry)
            });
        }
        return write(lines);
    }

    public String serviceCsv(ReportSummary summary) {
        List<String[]> lines = new ArrayList<>();
        lines.add(SERVICE_HEADER);
        for (BreakdownEntry entry : summary.getServices()) {
            lines.add(new String[]{
                    entry.getLabel(),
                    plainAmount(entry.getAmount()),
                    String.valueOf(entry.getCount()),
                    plainAmount(average(entry.getAmount(), entry.getCount())),
                    percent(entry.getAmount(), summary.getTotal())
            });
        }
        return write(lines);
    }

    static String payerDetail(BreakdownEntry entry) {
        if (!entry.hasDetails()) {
            return PLACEHOLDER;
        }
        return entry.getDetails().entrySet().stream()
                .map(e -> e.getKey() + ": " + plainAmount(e.getValue().getAmount()) + " (" + e.getValue().getCount() + " vehicles)")
                .collect(Collectors.joining("; "));
    }

    private static String write(List<String[]> lines) {
        StringWriter out = new StringWriter();
        try (CSVWriter csvWriter = new CSVWriter(out,
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                ICSVWriter.DEFAULT_LINE_END)) {
            csvWriter.writeAll(lines, false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write csv", e);
        }
        return out.toString();
    }
}
