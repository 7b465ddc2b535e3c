package com.autolog.ops.DailyReportService.util;

import java.util.Arrays;

public final class EmailServiceUtils {

    private EmailServiceUtils() {
    }

    public static String[] commaSeparatedStringToArray(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    public static boolean hasAddress(String value) {
        String[] addresses = commaSeparatedStringToArray(value);
        return addresses != null && addresses.length > 0;
    }
}
