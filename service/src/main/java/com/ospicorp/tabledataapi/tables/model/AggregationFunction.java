package com.ospicorp.tabledataapi.tables.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Query shapes applied to the {@code value} column. Every variant except {@link #RAW} collapses
 * rows sharing the same {@code (index, date, time)} triple into one aggregated row.
 */
public enum AggregationFunction {
  RAW(null),
  AVERAGE("AVG"),
  MIN("MIN"),
  MAX("MAX"),
  SUM("SUM");

  private static final String VALUE_EXPRESSION = "\"value\"::numeric";

  private final String sqlAggregate;

  AggregationFunction(String sqlAggregate) {
    this.sqlAggregate = sqlAggregate;
  }

  /** Wire name, as accepted in the {@code function} request parameter. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean groups() {
    return sqlAggregate != null;
  }

  public String projection() {
    String value = groups() ? sqlAggregate + "(" + VALUE_EXPRESSION + ")" : VALUE_EXPRESSION;
    return "SELECT \"index\", \"date\", \"time\", " + value + " AS \"value\"";
  }

  public String groupBy() {
    return groups() ? " GROUP BY \"index\", \"date\", \"time\"" : "";
  }

  public static Optional<AggregationFunction> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String normalized = key.trim().toLowerCase(Locale.ROOT);
    for (AggregationFunction function : values()) {
      if (function.key().equals(normalized)) {
        return Optional.of(function);
      }
    }
    return Optional.empty();
  }
}
