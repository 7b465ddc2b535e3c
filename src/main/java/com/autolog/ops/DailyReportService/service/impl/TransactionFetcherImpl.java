package com.autolog.ops.DailyReportService.service.impl;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import com.autolog.ops.DailyReportService.database.store.RecordStore;
import com.autolog.ops.DailyReportService.database.store.RowValues;
import com.autolog.ops.DailyReportService.database.store.TransactionQuery;
import com.autolog.ops.DailyReportService.dto.report.OwnerInfo;
import com.autolog.ops.DailyReportService.dto.report.ReportWindow;
import com.autolog.ops.DailyReportService.dto.report.TransactionRecord;
import com.autolog.ops.DailyReportService.dto.report.VehicleInfo;
import com.autolog.ops.DailyReportService.exception.FetchException;
import com.autolog.ops.DailyReportService.service.TransactionFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

import static com.autolog.ops.DailyReportService.database.store.TransactionColumns.*;

@Service
public class TransactionFetcherImpl implements TransactionFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionFetcherImpl.class);

    private final RecordStore recordStore;
    private final DailyReportProperties dailyReportProperties;

    public TransactionFetcherImpl(RecordStore recordStore, DailyReportProperties dailyReportProperties) {
        this.recordStore = recordStore;
        this.dailyReportProperties = dailyReportProperties;
    }

    @Override
    public List<TransactionRecord> fetch(Collection<Long> locationIds, ReportWindow window, Long customerId) {
        if (locationIds == null || locationIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> rows;
        List<Long> detailLinks;
        Map<Long, String> models;
        try {
            rows = recordStore.findApprovedTransactions(
                    new TransactionQuery(List.copyOf(locationIds), window.getStart(), window.getEnd(), customerId));
            if (rows.isEmpty()) {
                LOGGER.info("No approved transactions for locations {} on {}", locationIds, window.getDate());
                return Collections.emptyList();
            }
            // second stage: one lookup for every distinct detail link
            Set<Long> detailIds = new LinkedHashSet<>();
            detailLinks = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                Long detailId = detailLink(row);
                detailLinks.add(detailId);
                if (detailId != null) {
                    detailIds.add(detailId);
                }
            }
            models = detailIds.isEmpty() ? Collections.emptyMap() : recordStore.findVehicleModels(detailIds);
        } catch (DataAccessException e) {
            LOGGER.error("Failed to fetch transactions for locations {}: {}", locationIds, e.getMessage(), e);
            throw new FetchException("Failed to fetch data: " + e.getMostSpecificCause().getMessage(), e);
        }

        Map<Long, OwnerInfo> owners = new HashMap<>();
        List<TransactionRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(toRecord(rows.get(i), detailLinks.get(i), models, owners));
        }
        LOGGER.info("Fetched {} approved transactions for locations {} on {}", records.size(), locationIds, window.getDate());
        return records;
    }

    private TransactionRecord toRecord(Map<String, Object> row, Long detailId, Map<Long, String> models,
                                       Map<Long, OwnerInfo> owners) {
        Long customerId = RowValues.id(row, CUSTOMER_ID);
        OwnerInfo owner = customerId == null
                ? OwnerInfo.UNKNOWN
                : owners.computeIfAbsent(customerId, id -> new OwnerInfo(
                        RowValues.string(row, OWNER_NAME), RowValues.string(row, OWNER_CONTACT)));

        String model = detailId == null ? "" : models.getOrDefault(detailId, "");
        if (detailId != null && model.isEmpty()) {
            LOGGER.warn("No vehicle model reference row for detail id {}; using empty model", detailId);
        }
        VehicleInfo vehicle = new VehicleInfo(
                RowValues.string(row, PLATE_NUMBER), RowValues.string(row, VEHICLE_TYPE), model == null ? "" : model);

        return TransactionRecord.builder()
                .id(RowValues.id(row, ID))
                .customerId(customerId)
                .vehicleId(RowValues.id(row, VEHICLE_ID))
                .locationId(RowValues.id(row, LOCATION_ID))
                .createdAt(RowValues.instant(row, CREATED_AT))
                .amount(resolveAmount(row))
                .paymentMode(RowValues.string(row, PAYMENT_MODE))
                .service(RowValues.string(row, SERVICE))
                .entryType(RowValues.string(row, ENTRY_TYPE))
                .payerName(RowValues.string(row, PAYER_NAME))
                .owner(owner)
                .vehicle(vehicle)
                .build();
    }

    /**
     * Vehicle detail link of a row. A link that is not numeric cannot match a reference row and
     * is treated as absent.
     */
    private Long detailLink(Map<String, Object> row) {
        try {
            return RowValues.id(row, VEHICLE_DETAIL_ID);
        } catch (NumberFormatException e) {
            LOGGER.warn("Ignoring non numeric vehicle detail link '{}' of transaction {}; using empty model",
                    row.get(VEHICLE_DETAIL_ID), row.get(ID));
            return null;
        }
    }

    /**
     * First populated column of the configured amount columns, zero when none is.
     */
    BigDecimal resolveAmount(Map<String, Object> row) {
        for (String column : dailyReportProperties.getStore().getAmountColumns()) {
            BigDecimal value;
            try {
                value = RowValues.decimal(row.get(column));
            } catch (NumberFormatException e) {
                LOGGER.warn("Ignoring non numeric amount in column {} of transaction {}", column, row.get(ID));
                continue;
            }
            if (value != null) {
                return value.setScale(2, RoundingMode.HALF_UP);
            }
        }
        return BigDecimal.ZERO.setScale(2);
    }
}
