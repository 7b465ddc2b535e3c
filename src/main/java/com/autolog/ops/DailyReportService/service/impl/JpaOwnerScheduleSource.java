package com.autolog.ops.DailyReportService.service.impl;

import com.autolog.ops.DailyReportService.database.model.Location;
import com.autolog.ops.DailyReportService.database.model.ReportOwner;
import com.autolog.ops.DailyReportService.database.repository.LocationRepository;
import com.autolog.ops.DailyReportService.database.repository.ReportOwnerRepository;
import com.autolog.ops.DailyReportService.dto.report.LocationRef;
import com.autolog.ops.DailyReportService.dto.report.OwnerSchedule;
import com.autolog.ops.DailyReportService.service.OwnerScheduleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Lists owners from the users table. An owner's locations are the ones they own plus their
 * assigned location, ordered by id. Two location queries per call regardless of owner count.
 */
@Service
public class JpaOwnerScheduleSource implements OwnerScheduleSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(JpaOwnerScheduleSource.class);

    private final ReportOwnerRepository reportOwnerRepository;
    private final LocationRepository locationRepository;

    public JpaOwnerScheduleSource(ReportOwnerRepository reportOwnerRepository, LocationRepository locationRepository) {
        this.reportOwnerRepository = reportOwnerRepository;
        this.locationRepository = locationRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<OwnerSchedule> listOwners(Collection<Long> ownerIds) {
        List<ReportOwner> owners = ownerIds == null || ownerIds.isEmpty()
                ? reportOwnerRepository.findByRoleOrderByIdAsc(ReportOwner.OWNER_ROLE)
                : reportOwnerRepository.findByRoleAndIdInOrderByIdAsc(ReportOwner.OWNER_ROLE, ownerIds);
        if (owners.isEmpty()) {
            LOGGER.info("No owners found for filter {}", ownerIds);
            return Collections.emptyList();
        }

        List<Long> ids = owners.stream().map(ReportOwner::getId).collect(Collectors.toList());
        Map<Long, List<Location>> owned = locationRepository.findByOwnerIdInOrderByIdAsc(ids).stream()
                .collect(Collectors.groupingBy(Location::getOwnerId, LinkedHashMap::new, Collectors.toList()));

        Set<Long> assignedIds = owners.stream()
                .map(ReportOwner::getAssignedLocation)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        Map<Long, Location> assigned = assignedIds.isEmpty()
                ? Collections.emptyMap()
                : locationRepository.findByIdInOrderByIdAsc(assignedIds).stream()
                .collect(Collectors.toMap(Location::getId, l -> l));

        List<OwnerSchedule> schedules = new ArrayList<>(owners.size());
        for (ReportOwner owner : owners) {
            TreeMap<Long, LocationRef> locations = new TreeMap<>();
            for (Location location : owned.getOrDefault(owner.getId(), Collections.emptyList())) {
                locations.put(location.getId(), new LocationRef(location.getId(), location.getName()));
            }
            Long assignedId = owner.getAssignedLocation();
            if (assignedId != null && !locations.containsKey(assignedId)) {
                Location location = assigned.get(assignedId);
                if (location != null) {
                    locations.put(assignedId, new LocationRef(assignedId, location.getName()));
                } else {
                    LOGGER.warn("Owner {} has assigned location {} which does not exist", owner.getId(), assignedId);
                }
            }
            schedules.add(OwnerSchedule.builder()
                    .ownerId(owner.getId())
                    .displayName(owner.getDisplayName())
                    .email(owner.getEmail())
                    .templateNo(owner.getTemplateNo())
                    .timezone(owner.getTimezone())
                    .locations(List.copyOf(locations.values()))
                    .build());
        }
        LOGGER.info("Listed {} owners for reporting", schedules.size());
        return schedules;
    }
}
