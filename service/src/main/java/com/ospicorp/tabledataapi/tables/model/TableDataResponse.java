package com.ospicorp.tabledataapi.tables.model;

import java.util.List;

public record TableDataResponse(
    String status,
    List<DataRow> data,
    TableStatistics statistics,
    QueryMetadata metadata
) {

  public static TableDataResponse success(List<DataRow> data, TableStatistics statistics,
      QueryMetadata metadata) {
    return new TableDataResponse("success", data, statistics, metadata);
  }
}
