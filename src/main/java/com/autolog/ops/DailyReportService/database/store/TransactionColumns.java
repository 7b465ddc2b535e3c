package com.autolog.ops.DailyReportService.database.store;

/**
 * Column labels of a joined transaction row.
 */
public final class TransactionColumns {

    public static final String ID = "id";
    public static final String LOCATION_ID = "loc_id";
    public static final String CUSTOMER_ID = "cust_id";
    public static final String VEHICLE_ID = "vehicle_id";
    public static final String CREATED_AT = "created_at";
    public static final String APPROVAL_STATUS = "approval_status";
    public static final String PAYMENT_MODE = "payment_mode";
    public static final String SERVICE = "service";
    public static final String ENTRY_TYPE = "entry_type";
    public static final String PAYER_NAME = "upi_account_name";

    public static final String OWNER_NAME = "joined_owner_name";
    public static final String OWNER_CONTACT = "joined_owner_contact";
    public static final String PLATE_NUMBER = "joined_plate_number";
    public static final String VEHICLE_TYPE = "joined_vehicle_type";
    public static final String VEHICLE_DETAIL_ID = "joined_vehicle_detail_id";

    private TransactionColumns() {
    }
}
