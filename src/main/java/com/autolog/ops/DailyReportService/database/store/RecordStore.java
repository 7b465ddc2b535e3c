package com.autolog.ops.DailyReportService.database.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read access to the transaction log and its reference tables. Implementations must tolerate
 * concurrent callers; failures surface as {@link org.springframework.dao.DataAccessException}.
 */
public interface RecordStore {

    /**
     * Approved transactions of the query's locations inside {@code [start, end)}, joined with
     * customer and vehicle columns (see {@link TransactionColumns}), oldest first.
     */
    List<Map<String, Object>> findApprovedTransactions(TransactionQuery query);

    /**
     * Model names of the given vehicle-detail ids in one lookup. Ids without a row are absent.
     */
    Map<Long, String> findVehicleModels(Collection<Long> vehicleDetailIds);
}
