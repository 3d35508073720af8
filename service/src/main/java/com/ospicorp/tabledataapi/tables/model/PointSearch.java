package com.ospicorp.tabledataapi.tables.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/** Search criteria for single data points; every criterion except the table is optional (null). */
public record PointSearch(String table, String index, LocalDate date, LocalTime time,
    BigDecimal value) {
  public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

  /** The criteria that were given, as echoed in the response metadata. */
  public Map<String, String> describe() {
    Map<String, String> criteria = new LinkedHashMap<>();
    criteria.put("table", table);
    if (index != null) {
      criteria.put("index", index);
    }
    if (date != null) {
      criteria.put("date", date.toString());
    }
    if (time != null) {
      criteria.put("time", TIME_FORMAT.format(time));
    }
    if (value != null) {
      criteria.put("value", value.toPlainString());
    }
    return criteria;
  }
}
