package com.spreadsheet.reactive.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of POST /sheet, e.g. { "rows": 3, "columns": 3 }.
 * Either field may be omitted to use the configured default.
 */
public class CreateSheetRequest {
    private final Integer rows;
    private final Integer columns;

    @JsonCreator
    public CreateSheetRequest(@JsonProperty("rows") Integer rows,
                              @JsonProperty("columns") Integer columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public Integer getRows() {
        return rows;
    }

    public Integer getColumns() {
        return columns;
    }
}
