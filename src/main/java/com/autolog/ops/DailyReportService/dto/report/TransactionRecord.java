package com.autolog.ops.DailyReportService.dto.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One approved transaction, already joined with its customer and vehicle.
 */
@Value
@Builder(toBuilder = true)
public class TransactionRecord {

    Long id;
    Long customerId;
    Long vehicleId;
    Long locationId;
    Instant createdAt;
    BigDecimal amount;
    String paymentMode;
    String service;
    String entryType;
    String payerName;
    OwnerInfo owner;
    VehicleInfo vehicle;
}
