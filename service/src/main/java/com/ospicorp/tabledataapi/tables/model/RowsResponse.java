package com.ospicorp.tabledataapi.tables.model;

import java.util.List;
import java.util.Map;

public record RowsResponse(
    String status,
    List<DataRow> data,
    Map<String, String> metadata
) {

  public static RowsResponse success(List<DataRow> data, Map<String, String> metadata) {
    return new RowsResponse("success", data, metadata);
  }
}
