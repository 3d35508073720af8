package com.ospicorp.tabledataapi.tables.service;

import com.ospicorp.tabledataapi.tables.model.AggregationFunction;
import com.ospicorp.tabledataapi.tables.model.BuiltQuery;
import com.ospicorp.tabledataapi.tables.model.DateRange;
import com.ospicorp.tabledataapi.tables.model.PointSearch;
import com.ospicorp.tabledataapi.tables.model.QueryParameters;
import com.ospicorp.tabledataapi.tables.model.TableIdentifier;
import java.util.ArrayList;
import java.util.List;

public final class QueryBuilder {
  private static final String DATE_FILTER = " WHERE \"date\" = ?";
  private static final String ROW_ORDER = " ORDER BY \"date\", \"time\", \"index\"";

  // Imported tables keep date and time as text; empty strings read as NULL
  private static final String DAY = "NULLIF(\"date\"::text, '')::date";
  private static final String CLOCK = "NULLIF(\"time\"::text, '')::time";
  private static final String TYPED_PROJECTION = "SELECT \"index\", "
      + DAY + "::text AS \"date\", "
      + CLOCK + "::text AS \"time\", "
      + "\"value\"::numeric AS \"value\"";
  private static final String VALUE_TOLERANCE = "0.000001";

  private QueryBuilder() {
  }

  public static BuiltQuery rowQuery(TableIdentifier table, QueryParameters params) {
    AggregationFunction function = params.function();
    String sql = function.projection()
        + " FROM " + table.sql()
        + DATE_FILTER
        + function.groupBy()
        + ROW_ORDER;
    return new BuiltQuery(sql, List.of(params.date()));
  }

  // Covers every raw row for the date, whatever function the row query used
  public static BuiltQuery statisticsQuery(TableIdentifier table, QueryParameters params) {
    String sql = "SELECT COUNT(*) AS count,"
        + " MIN(\"value\"::numeric) AS min_value,"
        + " MAX(\"value\"::numeric) AS max_value,"
        + " AVG(\"value\"::numeric) AS avg_value"
        + " FROM " + table.sql()
        + DATE_FILTER;
    return new BuiltQuery(sql, List.of(params.date()));
  }

  public static BuiltQuery searchQuery(TableIdentifier table, PointSearch search) {
    List<String> conditions = new ArrayList<>();
    List<Object> parameters = new ArrayList<>();
    if (search.index() != null) {
      conditions.add("\"index\"::text = ?");
      parameters.add(search.index());
    }
    if (search.date() != null) {
      conditions.add(DAY + " = ?");
      parameters.add(search.date());
    }
    if (search.time() != null) {
      conditions.add(CLOCK + " = ?");
      parameters.add(search.time());
    }
    if (search.value() != null) {
      conditions.add("ABS(\"value\"::numeric - ?) < " + VALUE_TOLERANCE);
      parameters.add(search.value());
    }
    String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    String sql = TYPED_PROJECTION + " FROM " + table.sql() + where + ROW_ORDER;
    return new BuiltQuery(sql, parameters);
  }

  public static BuiltQuery rangeQuery(TableIdentifier table, DateRange range) {
    String sql = TYPED_PROJECTION
        + " FROM " + table.sql()
        + " WHERE " + DAY + " BETWEEN ? AND ?"
        + ROW_ORDER;
    return new BuiltQuery(sql, List.of(range.start(), range.end()));
  }
}
