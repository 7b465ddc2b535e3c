package com.autolog.ops.DailyReportService.dto.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Owner entry as listed by the schedule source, before request overrides are applied.
 */
@Value
@Builder
public class OwnerSchedule {

    Long ownerId;
    String displayName;
    String email;
    Integer templateNo;
    String timezone;
    List<LocationRef> locations;
}
