package com.autolog.ops.DailyReportService.database.repository;

import com.autolog.ops.DailyReportService.database.model.Location;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface LocationRepository extends JpaRepository<Location, Long> {

    List<Location> findByOwnerIdInOrderByIdAsc(Collection<Long> ownerIds);

    List<Location> findByIdInOrderByIdAsc(Collection<Long> ids);
}
