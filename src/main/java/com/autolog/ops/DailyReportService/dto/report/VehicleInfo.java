package com.autolog.ops.DailyReportService.dto.report;

import lombok.Value;

@Value
public class VehicleInfo {

    public static final VehicleInfo UNKNOWN = new VehicleInfo(null, null, "");

    String plateNumber;
    String vehicleType;
    /** Empty when the vehicle has no detail link or the reference row is missing. */
    String modelName;
}
