package com.spreadsheet.reactive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpreadsheetApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpreadsheetApplication.class, args);
    }
}
