package com.autolog.ops.DailyReportService.dto.report;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Resolved per-owner input of one run. Overrides are already applied; never mutated afterwards.
 */
@Value
@Builder
public class OwnerRunContext {

    Long ownerId;
    String ownerName;
    String recipient;
    int templateSelector;
    String timezone;
    List<LocationRef> locations;
    LocalDate reportDate;
    String triggerSource;
}
