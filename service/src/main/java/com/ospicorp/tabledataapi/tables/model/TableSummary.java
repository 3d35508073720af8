package com.ospicorp.tabledataapi.tables.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record TableSummary(
    String table,
    @JsonProperty("total_rows") long totalRows,
    @JsonProperty("unique_indices") long uniqueIndices,
    @JsonProperty("min_date") String minDate,
    @JsonProperty("max_date") String maxDate,
    List<DataRow> preview
) {}
