package com.ospicorp.tabledataapi.tables.controller;

import com.ospicorp.tabledataapi.tables.exception.InvalidParameterException;
import com.ospicorp.tabledataapi.tables.model.ErrorEnvelope;
import com.ospicorp.tabledataapi.tables.model.RowsResponse;
import com.ospicorp.tabledataapi.tables.model.TableDataResponse;
import com.ospicorp.tabledataapi.tables.model.TableSummary;
import com.ospicorp.tabledataapi.tables.service.TableQueryService;
import com.ospicorp.tabledataapi.web.CsvHttpMessageConverter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Tag(name = "Data")
public class TableDataController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final TableQueryService svc;

  public TableDataController(TableQueryService svc) {
    this.svc = svc;
  }

  @GetMapping("/data")
  @Operation(summary = "Query table data",
      description = "Rows of a table for one date, optionally aggregated per (index, date, time), "
          + "with count/min/max/avg statistics over the same date.",
      parameters = {
          @Parameter(in = ParameterIn.QUERY, name = "table", required = true,
              description = "Table name", example = "sensor1"),
          @Parameter(in = ParameterIn.QUERY, name = "date", required = true,
              description = "Date to filter on", example = "2024-01-01"),
          @Parameter(in = ParameterIn.QUERY, name = "function",
              description = "Aggregation applied to value: raw, average, min, max or sum",
              schema = @Schema(defaultValue = "raw",
                  allowableValues = {"raw", "average", "min", "max", "sum"})),
          @Parameter(in = ParameterIn.QUERY, name = "format",
              description = "Response format", schema = @Schema(allowableValues = {"json", "csv"}))
      })
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Rows, statistics and metadata",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = TableDataResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "500", description = "Validation, lookup or database failure",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ErrorEnvelope.class)))
  })
  public ResponseEntity<?> data(@Parameter(hidden = true) @RequestParam Map<String, String> params,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(params.get("format"), accept);
    TableDataResponse response = svc.query(params);

    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? response.data() : response;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @GetMapping("/data/range")
  @Operation(summary = "Query a date range",
      description = "Raw rows of a table whose date falls between start and end, both inclusive.",
      parameters = {
          @Parameter(in = ParameterIn.QUERY, name = "table", required = true,
              description = "Table name", example = "sensor1"),
          @Parameter(in = ParameterIn.QUERY, name = "start", required = true,
              description = "First date (YYYY-MM-DD)", example = "2024-01-01"),
          @Parameter(in = ParameterIn.QUERY, name = "end", required = true,
              description = "Last date (YYYY-MM-DD)", example = "2024-01-31"),
          @Parameter(in = ParameterIn.QUERY, name = "format",
              description = "Response format", schema = @Schema(allowableValues = {"json", "csv"}))
      })
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Rows ordered by date, time and index",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = RowsResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "500", description = "Validation, lookup or database failure",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ErrorEnvelope.class)))
  })
  public ResponseEntity<?> range(@Parameter(hidden = true) @RequestParam Map<String, String> params,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(params.get("format"), accept);
    return rows(svc.range(params), contentType);
  }

  @GetMapping("/tables/{table}/points")
  @Tag(name = "Tables")
  @Operation(summary = "Search data points",
      description = "Rows matching every given criterion. A time of HH:MM means HH:MM:00; "
          + "values match within 0.000001.",
      parameters = {
          @Parameter(in = ParameterIn.QUERY, name = "index", description = "Exact index"),
          @Parameter(in = ParameterIn.QUERY, name = "date", description = "Date (YYYY-MM-DD)",
              example = "2024-01-01"),
          @Parameter(in = ParameterIn.QUERY, name = "time", description = "Time (HH:MM[:SS])",
              example = "00:00"),
          @Parameter(in = ParameterIn.QUERY, name = "value", description = "Reading",
              example = "10"),
          @Parameter(in = ParameterIn.QUERY, name = "format",
              description = "Response format", schema = @Schema(allowableValues = {"json", "csv"}))
      })
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Matching rows ordered by date and time",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = RowsResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "500", description = "Validation, lookup or database failure",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ErrorEnvelope.class)))
  })
  public ResponseEntity<?> points(@PathVariable
      @Parameter(description = "Table name", example = "sensor1") String table,
      @Parameter(hidden = true) @RequestParam Map<String, String> params,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(params.get("format"), accept);
    return rows(svc.search(table, params), contentType);
  }

  @GetMapping("/tables")
  @Tag(name = "Tables")
  @Operation(summary = "List tables", description = "Names of the tables that can be queried, sorted.")
  public Map<String, List<String>> tables() {
    return Map.of("tables", svc.listTables());
  }

  @GetMapping("/tables/{table}/summary")
  @Tag(name = "Tables")
  @Operation(summary = "Summarize a table",
      description = "Row count, distinct index count, date range and the first rows of a table.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Table summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TableSummary.class))),
      @ApiResponse(responseCode = "500", description = "Unknown table or database failure",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ErrorEnvelope.class)))
  })
  public TableSummary summary(@PathVariable
      @Parameter(description = "Table name", example = "sensor1") String table) {
    return svc.summarize(table);
  }

  private static ResponseEntity<?> rows(RowsResponse response, MediaType contentType) {
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? response.data() : response;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value",
          InvalidParameterException.INVALID_FORMAT, "Supported values: json,csv.");
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes;
    try {
      mediaTypes = MediaType.parseMediaTypes(accept);
    } catch (IllegalArgumentException ex) {
      return MediaType.APPLICATION_JSON;
    }
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
