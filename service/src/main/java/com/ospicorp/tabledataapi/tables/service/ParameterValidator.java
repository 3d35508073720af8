package com.ospicorp.tabledataapi.tables.service;

import com.ospicorp.tabledataapi.tables.exception.InvalidParameterException;
import com.ospicorp.tabledataapi.tables.exception.MissingParameterException;
import com.ospicorp.tabledataapi.tables.model.AggregationFunction;
import com.ospicorp.tabledataapi.tables.model.DateRange;
import com.ospicorp.tabledataapi.tables.model.PointSearch;
import com.ospicorp.tabledataapi.tables.model.QueryParameters;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns raw query-string parameters into {@link QueryParameters}.
 *
 * <p>{@code table} and {@code date} are required; {@code function} defaults to {@code raw}. Unknown
 * function keys fall back to {@code raw} unless {@code tabledata.query.strict-function} is set, in
 * which case they are rejected.
 *
 * <p>Point searches and date ranges parse their dates, times and values up front, so a malformed
 * criterion is rejected before any SQL runs.
 */
@Component
public class ParameterValidator {
  private static final Logger log = LoggerFactory.getLogger(ParameterValidator.class);
  private static final Pattern MARKUP = Pattern.compile("<[^>]*>?");
  private static final Pattern CONTROL = Pattern.compile("\\p{Cntrl}");
  private static final Pattern HOUR_MINUTE = Pattern.compile("^\\d{1,2}:\\d{2}$");
  private static final DateTimeFormatter TIME_INPUT = DateTimeFormatter.ofPattern("H:mm:ss");
  private static final int VALUE_SCALE = 6;
  private static final String SUPPORTED_FUNCTIONS = Arrays.stream(AggregationFunction.values())
      .map(AggregationFunction::key)
      .collect(Collectors.joining(","));

  private final boolean strictFunction;

  public ParameterValidator(@Value("${tabledata.query.strict-function:false}") boolean strictFunction) {
    this.strictFunction = strictFunction;
  }

  public QueryParameters validate(Map<String, String> params) {
    String table = required(params, "table");
    String date = required(params, "date");
    AggregationFunction function = resolveFunction(params.get("function"));
    return new QueryParameters(table, date, function);
  }

  public PointSearch validateSearch(String table, Map<String, String> params) {
    String name = sanitize(table);
    if (!StringUtils.hasText(name)) {
      throw new MissingParameterException("table");
    }
    String index = optional(params, "index");
    LocalDate date = parseDate("date", optional(params, "date"));
    LocalTime time = parseTime(optional(params, "time"));
    BigDecimal value = parseValue(optional(params, "value"));
    return new PointSearch(name, index, date, time, value);
  }

  public DateRange validateRange(Map<String, String> params) {
    String table = required(params, "table");
    LocalDate start = parseDate("start", required(params, "start"));
    LocalDate end = parseDate("end", required(params, "end"));
    if (start.isAfter(end)) {
      throw new InvalidParameterException("Invalid date range",
          InvalidParameterException.INVALID_RANGE, "'start' must not be after 'end'");
    }
    return new DateRange(table, start, end);
  }

  public String sanitize(String raw) {
    if (raw == null) {
      return null;
    }
    String stripped = MARKUP.matcher(raw).replaceAll("");
    return CONTROL.matcher(stripped).replaceAll("").trim();
  }

  private String required(Map<String, String> params, String name) {
    String value = sanitize(params.get(name));
    if (!StringUtils.hasText(value)) {
      throw new MissingParameterException(name);
    }
    return value;
  }

  private String optional(Map<String, String> params, String name) {
    String value = sanitize(params.get(name));
    return StringUtils.hasText(value) ? value : null;
  }

  private static LocalDate parseDate(String name, String raw) {
    if (raw == null) {
      return null;
    }
    try {
      return LocalDate.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new InvalidParameterException("Invalid " + name + " value",
          InvalidParameterException.INVALID_DATE, "Expected YYYY-MM-DD, got '" + raw + "'");
    }
  }

  // HH:MM is read as HH:MM:00
  private static LocalTime parseTime(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = HOUR_MINUTE.matcher(raw).matches() ? raw + ":00" : raw;
    try {
      return LocalTime.parse(normalized, TIME_INPUT);
    } catch (DateTimeParseException ex) {
      throw new InvalidParameterException("Invalid time value",
          InvalidParameterException.INVALID_TIME, "Expected HH:MM or HH:MM:SS, got '" + raw + "'");
    }
  }

  private static BigDecimal parseValue(String raw) {
    if (raw == null) {
      return null;
    }
    try {
      BigDecimal value = new BigDecimal(raw);
      return value.scale() > VALUE_SCALE ? value.setScale(VALUE_SCALE, RoundingMode.HALF_UP) : value;
    } catch (NumberFormatException ex) {
      throw new InvalidParameterException("Invalid value",
          InvalidParameterException.INVALID_VALUE, "Expected a number, got '" + raw + "'");
    }
  }

  private AggregationFunction resolveFunction(String raw) {
    String key = sanitize(raw);
    if (!StringUtils.hasText(key)) {
      return AggregationFunction.RAW;
    }
    return AggregationFunction.fromKey(key).orElseGet(() -> {
      if (strictFunction) {
        throw new InvalidParameterException("Unknown function '" + key + "'",
            InvalidParameterException.UNKNOWN_FUNCTION, "Supported values: " + SUPPORTED_FUNCTIONS);
      }
      log.debug("Unknown function '{}', falling back to raw", key);
      return AggregationFunction.RAW;
    });
  }
}
