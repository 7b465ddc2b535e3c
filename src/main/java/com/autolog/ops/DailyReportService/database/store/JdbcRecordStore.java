package com.autolog.ops.DailyReportService.database.store;

import com.autolog.ops.DailyReportService.config.DailyReportProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.autolog.ops.DailyReportService.database.store.TransactionColumns.*;

@Repository
public class JdbcRecordStore implements RecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcRecordStore.class);

    // plain or quoted identifiers, e.g. logs_man, `logs-man`, "logs-man"
    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z0-9_.`\"-]+$");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String transactionSql;
    private final String customerFilterSql;
    private final String vehicleModelSql;
    private final String approvedStatus;

    public JdbcRecordStore(NamedParameterJdbcTemplate jdbcTemplate, DailyReportProperties dailyReportProperties) {
        this.jdbcTemplate = jdbcTemplate;
        DailyReportProperties.Store store = dailyReportProperties.getStore();
        this.approvedStatus = store.getApprovedStatus();
        this.transactionSql = "SELECT l.*,"
                + " c.name AS " + OWNER_NAME + ","
                + " c.phone AS " + OWNER_CONTACT + ","
                + " v.vehicle_number AS " + PLATE_NUMBER + ","
                + " v.vehicle_type AS " + VEHICLE_TYPE + ","
                + " v.veh_det AS " + VEHICLE_DETAIL_ID
                + " FROM " + table(store.getTransactionTable()) + " l"
                + " LEFT JOIN " + table(store.getCustomerTable()) + " c ON c.id = l." + CUSTOMER_ID
                + " LEFT JOIN " + table(store.getVehicleTable()) + " v ON v.id = l." + VEHICLE_ID
                + " WHERE l." + APPROVAL_STATUS + " = :approvalStatus"
                + " AND l." + CREATED_AT + " >= :start AND l." + CREATED_AT + " < :end"
                + " AND l." + LOCATION_ID + " IN (:locationIds)";
        this.customerFilterSql = " AND l." + CUSTOMER_ID + " = :customerId";
        this.vehicleModelSql = "SELECT id, model_name FROM " + table(store.getVehicleDetailTable()) + " WHERE id IN (:ids)";
    }

    @Override
    public List<Map<String, Object>> findApprovedTransactions(TransactionQuery query) {
        if (query.getLocationIds() == null || query.getLocationIds().isEmpty()) {
            return Collections.emptyList();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("approvalStatus", approvedStatus)
                .addValue("start", Timestamp.from(query.getStart()))
                .addValue("end", Timestamp.from(query.getEnd()))
                .addValue("locationIds", query.getLocationIds());
        StringBuilder sql = new StringBuilder(transactionSql);
        if (query.getCustomerId() != null) {
            sql.append(customerFilterSql);
            params.addValue("customerId", query.getCustomerId());
        }
        sql.append(" ORDER BY l.").append(CREATED_AT).append(" ASC, l.").append(ID).append(" ASC");

        LOGGER.debug("Querying approved transactions locations={} start={} end={} customer={}",
                query.getLocationIds(), query.getStart(), query.getEnd(), query.getCustomerId());
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql.toString(), params);
        LOGGER.debug("Approved transaction query returned {} rows", rows.size());
        return rows;
    }

    @Override
    public Map<Long, String> findVehicleModels(Collection<Long> vehicleDetailIds) {
        if (vehicleDetailIds == null || vehicleDetailIds.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<Long, String> models = new HashMap<>();
        jdbcTemplate.query(vehicleModelSql, new MapSqlParameterSource("ids", vehicleDetailIds), rs -> {
            models.put(rs.getLong("id"), rs.getString("model_name"));
        });
        LOGGER.debug("Resolved {} of {} vehicle models", models.size(), vehicleDetailIds.size());
        return models;
    }

    private static String table(String name) {
        if (name == null || !TABLE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid table name in report.store configuration: " + name);
        }
        return name;
    }
}
