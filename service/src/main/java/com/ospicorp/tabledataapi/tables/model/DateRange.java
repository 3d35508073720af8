package com.ospicorp.tabledataapi.tables.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

// Inclusive on both ends; start is never after end
public record DateRange(String table, LocalDate start, LocalDate end) {

  public Map<String, String> describe() {
    Map<String, String> range = new LinkedHashMap<>();
    range.put("table", table);
    range.put("start", start.toString());
    range.put("end", end.toString());
    return range;
  }
}
