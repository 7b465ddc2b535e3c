package com.autolog.ops.DailyReportService.service.impl;

import com.autolog.ops.DailyReportService.database.model.Location;
import com.autolog.ops.DailyReportService.database.model.ReportOwner;
import com.autolog.ops.DailyReportService.database.repository.LocationRepository;
import com.autolog.ops.DailyReportService.database.repository.ReportOwnerRepository;
import com.autolog.ops.DailyReportService.dto.report.LocationRef;
import com.autolog.ops.DailyReportService.dto.report.OwnerSchedule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaOwnerScheduleSource")
class JpaOwnerScheduleSourceTest {

    @Mock
    private ReportOwnerRepository reportOwnerRepository;

    @Mock
    private LocationRepository locationRepository;

    @InjectMocks
    private JpaOwnerScheduleSource source;

    @Test
    @DisplayName("owned locations plus the assigned one, ordered by id")
    void ownedPlusAssigned() {
        when(reportOwnerRepository.findByRoleOrderByIdAsc(ReportOwner.OWNER_ROLE))
                .thenReturn(List.of(owner(1L, "anil@autolog.test", "Anil", "Mehta", 5L), owner(2L, null, null, null, null)));
        when(locationRepository.findByOwnerIdInOrderByIdAsc(List.of(1L, 2L)))
                .thenReturn(List.of(location(3L, "Harbour Road", 1L), location(7L, "Lake View", 1L), location(4L, "Hill Top", 2L)));
        when(locationRepository.findByIdInOrderByIdAsc(Set.of(5L)))
                .thenReturn(List.of(location(5L, "Central", 9L)));

        List<OwnerSchedule> owners = source.listOwners(null);

        assertThat(owners).hasSize(2);
        assertThat(owners.get(0).getDisplayName()).isEqualTo("Anil Mehta");
        assertThat(owners.get(0).getLocations()).extracting(LocationRef::getId).containsExactly(3L, 5L, 7L);
        assertThat(owners.get(1).getDisplayName()).isEqualTo("2");
        assertThat(owners.get(1).getLocations()).extracting(LocationRef::getName).containsExactly("Hill Top");
    }

    @Test
    void assignedLocationAlreadyOwnedIsNotDuplicated() {
        when(reportOwnerRepository.findByRoleOrderByIdAsc(ReportOwner.OWNER_ROLE))
                .thenReturn(List.of(owner(1L, "anil@autolog.test", "Anil", null, 3L)));
        when(locationRepository.findByOwnerIdInOrderByIdAsc(List.of(1L)))
                .thenReturn(List.of(location(3L, "Harbour Road", 1L)));
        when(locationRepository.findByIdInOrderByIdAsc(Set.of(3L)))
                .thenReturn(List.of(location(3L, "Harbour Road", 1L)));

        assertThat(source.listOwners(List.of()).get(0).getLocations()).extracting(LocationRef::getId).containsExactly(3L);
    }

    @Test
    void ownerSubsetUsesFilteredQuery() {
        when(reportOwnerRepository.findByRoleAndIdInOrderByIdAsc(ReportOwner.OWNER_ROLE, List.of(2L))).thenReturn(List.of());

        assertThat(source.listOwners(List.of(2L))).isEmpty();
        verify(reportOwnerRepository, never()).findByRoleOrderByIdAsc(anyString());
        verifyNoInteractions(locationRepository);
    }

    @Test
    void displayNameFallsBackToEmail() {
        assertThat(owner(4L, "x@autolog.test", " ", null, null).getDisplayName()).isEqualTo("x@autolog.test");
        assertThat(new ReportOwner().getDisplayName()).isEqualTo("Unknown");
    }

    private static ReportOwner owner(Long id, String email, String first, String last, Long assigned) {
        ReportOwner owner = new ReportOwner();
        owner.setId(id);
        owner.setEmail(email);
        owner.setRole(ReportOwner.OWNER_ROLE);
        owner.setFirstName(first);
        owner.setLastName(last);
        owner.setAssignedLocation(assigned);
        return owner;
    }

    private static Location location(Long id, String name, Long ownerId) {
        Location location = new Location();
        location.setId(id);
        location.setName(name);
        location.setOwnerId(ownerId);
        return location;
    }
}
