package com.autolog.ops.DailyReportService;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DailyReportServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyReportServiceApplication.class, args);
    }

}
