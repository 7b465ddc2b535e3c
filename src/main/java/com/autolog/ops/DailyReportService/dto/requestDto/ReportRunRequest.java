package com.autolog.ops.DailyReportService.dto.requestDto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class ReportRunRequest {

    // null or empty = every owner
    private List<Long> ownerIds;

    @Email(message = "Email override must be a valid address")
    private String email;

    @Min(value = 1, message = "Template must be 1, 2 or 3")
    @Max(value = 3, message = "Template must be 1, 2 or 3")
    private Integer templateNo;

    private String timezone;

    private List<Long> locationIds;

    private LocalDate reportDate;

    private String triggerSource;
}
