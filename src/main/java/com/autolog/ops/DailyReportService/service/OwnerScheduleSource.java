package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.dto.report.OwnerSchedule;

import java.util.Collection;
import java.util.List;

public interface OwnerScheduleSource {

    /**
     * Owners to report on, ordered by id.
     *
     * @param ownerIds optional subset, {@code null} or empty for every owner
     */
    List<OwnerSchedule> listOwners(Collection<Long> ownerIds);
}
