package com.autolog.ops.DailyReportService.database.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

@Entity
@Table(name = "users")
@Data
@Immutable
public class ReportOwner {

    public static final String OWNER_ROLE = "owner";

    @Id
    private Long id;

    @Column(name = "email")
    private String email;

    @Column(name = "role")
    private String role;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column(name = "templateno")
    private Integer templateNo;

    @Column(name = "timezone")
    private String timezone;

    @Column(name = "assigned_location")
    private Long assignedLocation;

    public String getDisplayName() {
        String first = firstName == null ? "" : firstName.trim();
        String last = lastName == null ? "" : lastName.trim();
        if (!first.isEmpty() || !last.isEmpty()) {
            return (first + " " + last).trim();
        }
        if (email != null && !email.isBlank()) {
            return email;
        }
        return id != null ? String.valueOf(id) : "Unknown";
    }
}
