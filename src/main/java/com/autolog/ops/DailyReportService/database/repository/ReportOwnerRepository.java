package com.autolog.ops.DailyReportService.database.repository;

import com.autolog.ops.DailyReportService.database.model.ReportOwner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ReportOwnerRepository extends JpaRepository<ReportOwner, Long> {

    List<ReportOwner> findByRoleOrderByIdAsc(String role);

    List<ReportOwner> findByRoleAndIdInOrderByIdAsc(String role, Collection<Long> ids);
}
