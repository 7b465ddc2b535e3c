package com.autolog.ops.DailyReportService.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;


@ConfigurationProperties(prefix = "report")
@Data
public class DailyReportProperties {

    private Window window = new Window();
    private Template template = new Template();
    private Mail mail = new Mail();
    private Store store = new Store();
    private Schedule schedule = new Schedule();
    private Executor executor = new Executor();

    @Data
    public static class Window {
        private String defaultOffset = "+05:30";
    }

    @Data
    public static class Template {
        private int defaultTemplate = 1;
        private String logo = ""; // base64 png, embedded by templates 2 and 3
    }

    @Data
    public static class Mail {
        private String from;
        private String testRecipient;
        private boolean summaryEnabled = true;
        private String summaryRecipient;
    }

    @Data
    public static class Store {
        private String transactionTable = "logs_man";
        private String customerTable = "customers";
        private String vehicleTable = "vehicles";
        private String vehicleDetailTable = "vehicle_details";
        private String approvedStatus = "approved";
        // first populated column wins
        private List<String> amountColumns = new ArrayList<>(List.of("amount", "price", "total_amount"));
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 21 * * *";
        private String zone = "Asia/Kolkata";
    }

    @Data
    public static class Executor {
        private int poolSize = 4;
        private int queueCapacity = 100;
        private int awaitTerminationSeconds = 60;
    }

}
