package com.autolog.ops.DailyReportService.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ReportFormatUtilsTest {

    @Test
    void amountsHaveNoLocaleOrScientificForm() {
        assertThat(ReportFormatUtils.plainAmount(new BigDecimal("1E+3"))).isEqualTo("1000.00");
        assertThat(ReportFormatUtils.plainAmount(null)).isEqualTo("0.00");
        assertThat(ReportFormatUtils.currency(new BigDecimal("1234567.5"))).isEqualTo("₹1,234,567.50");
    }

    @Test
    void shares() {
        assertThat(ReportFormatUtils.percent(new BigDecimal("1"), new BigDecimal("3"))).isEqualTo("33.3%");
        assertThat(ReportFormatUtils.percent(BigDecimal.ONE, BigDecimal.ZERO)).isEqualTo("0.0%");
        assertThat(ReportFormatUtils.average(new BigDecimal("10"), 3)).isEqualTo(new BigDecimal("3.33"));
        assertThat(ReportFormatUtils.average(new BigDecimal("10"), 0)).isEqualTo(new BigDecimal("0.00"));
    }

    @Test
    void labels() {
        assertThat(ReportFormatUtils.hourLabel(0)).isEqualTo("12:00 AM");
        assertThat(ReportFormatUtils.hourLabel(12)).isEqualTo("12:00 PM");
        assertThat(ReportFormatUtils.hourLabel(21)).isEqualTo("9:00 PM");
        assertThat(ReportFormatUtils.slug("Main Street #2")).isEqualTo("main-street--2");
        assertThat(ReportFormatUtils.orPlaceholder(" ")).isEqualTo("N/A");
    }

    @Test
    void addressLists() {
        assertThat(EmailServiceUtils.commaSeparatedStringToArray("a@x.test, b@x.test ,")).containsExactly("a@x.test", "b@x.test");
        assertThat(EmailServiceUtils.hasAddress(" , ")).isFalse();
        assertThat(EmailServiceUtils.commaSeparatedStringToArray(null)).isNull();
    }
}
