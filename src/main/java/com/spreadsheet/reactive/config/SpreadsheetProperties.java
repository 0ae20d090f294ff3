package com.spreadsheet.reactive.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "spreadsheet" prefix in application.properties.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    // Dimensions used when a create request leaves them out
    private int defaultRows = 100;
    private int defaultColumns = 26;

    // Every cell is allocated when the sheet is created, so the row count has to be capped
    private int maxRows = 100_000;

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultColumns() {
        return defaultColumns;
    }

    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }
}
