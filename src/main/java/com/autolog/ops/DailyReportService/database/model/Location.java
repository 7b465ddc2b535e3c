package com.autolog.ops.DailyReportService.database.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

@Entity
@Table(name = "locations")
@Data
@Immutable
public class Location {

    @Id
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "owner_id")
    private Long ownerId;
}
