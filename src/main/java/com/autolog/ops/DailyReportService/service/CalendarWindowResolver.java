package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.dto.report.ReportWindow;
import com.autolog.ops.DailyReportService.exception.InvalidTimezoneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Turns a regional calendar day into the UTC interval {@code [local midnight, next local midnight)}.
 */
@Component
public class CalendarWindowResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarWindowResolver.class);

    private final DailyReportProperties dailyReportProperties;
    private final Clock clock;

    public CalendarWindowResolver(DailyReportProperties dailyReportProperties, Clock clock) {
        this.dailyReportProperties = dailyReportProperties;
        this.clock = clock;
    }

    public ReportWindow resolve(LocalDate date, String offsetOverride) {
        ZoneOffset offset = resolveOffset(offsetOverride);
        ReportWindow window = new ReportWindow(date, offset,
                date.atStartOfDay().toInstant(offset),
                date.plusDays(1).atStartOfDay().toInstant(offset));
        LOGGER.debug("Resolved window for {} at {}: [{}, {})", date, offset, window.getStart(), window.getEnd());
        return window;
    }

    /**
     * Override when present, otherwise the configured default. Named zones are pinned to their
     * offset at call time.
     */
    public ZoneOffset resolveOffset(String offsetOverride) {
        String value = offsetOverride == null || offsetOverride.isBlank()
                ? dailyReportProperties.getWindow().getDefaultOffset()
                : offsetOverride.trim();
        if (value == null) {
            throw new InvalidTimezoneException("No timezone override and no default offset configured");
        }
        try {
            ZoneId zone = ZoneId.of(value);
            return zone.getRules().getOffset(clock.instant());
        } catch (DateTimeException e) {
            throw new InvalidTimezoneException("Cannot resolve timezone '" + value + "' to a UTC offset", e);
        }
    }

    /** Current calendar day at the default regional offset. */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(resolveOffset(null)));
    }
}
