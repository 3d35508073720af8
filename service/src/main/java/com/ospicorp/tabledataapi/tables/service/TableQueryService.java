package com.ospicorp.tabledataapi.tables.service;

import com.ospicorp.tabledataapi.tables.model.BuiltQuery;
import com.ospicorp.tabledataapi.tables.model.DataRow;
import com.ospicorp.tabledataapi.tables.model.DateRange;
import com.ospicorp.tabledataapi.tables.model.PointSearch;
import com.ospicorp.tabledataapi.tables.model.QueryMetadata;
import com.ospicorp.tabledataapi.tables.model.QueryParameters;
import com.ospicorp.tabledataapi.tables.model.RowsResponse;
import com.ospicorp.tabledataapi.tables.model.TableDataResponse;
import com.ospicorp.tabledataapi.tables.model.TableIdentifier;
import com.ospicorp.tabledataapi.tables.model.TableStatistics;
import com.ospicorp.tabledataapi.tables.model.TableSummary;
import com.ospicorp.tabledataapi.tables.repository.TableDataDao;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class TableQueryService {
  private static final Logger log = LoggerFactory.getLogger(TableQueryService.class);

  private final ParameterValidator validator;
  private final TableCatalog catalog;
  private final TableDataDao dao;
  private final int previewLimit;

  public TableQueryService(ParameterValidator validator, TableCatalog catalog, TableDataDao dao,
      @Value("${tabledata.summary.preview-limit:5}") int previewLimit) {
    this.validator = validator;
    this.catalog = catalog;
    this.dao = dao;
    this.previewLimit = previewLimit;
  }

  public TableDataResponse query(Map<String, String> rawParams) {
    QueryParameters params = validator.validate(rawParams);
    TableIdentifier table = catalog.resolve(params.table());

    BuiltQuery rowQuery = QueryBuilder.rowQuery(table, params);
    List<DataRow> rows = dao.fetchRows(rowQuery);
    TableStatistics statistics = dao.fetchStatistics(QueryBuilder.statisticsQuery(table, params));

    log.debug("Query on {} for {} with function {} returned {} rows",
        table.name(), params.date(), params.function().key(), rows.size());

    QueryMetadata metadata = new QueryMetadata(table.name(), params.date(),
        params.function().key());
    return TableDataResponse.success(rows, statistics, metadata);
  }

  public List<String> listTables() {
    return catalog.listTables();
  }

  public TableSummary summarize(String table) {
    TableIdentifier identifier = catalog.resolve(validator.sanitize(table));
    return dao.summarize(identifier, previewLimit);
  }

  public RowsResponse search(String table, Map<String, String> rawParams) {
    PointSearch criteria = validator.validateSearch(table, rawParams);
    TableIdentifier identifier = catalog.resolve(criteria.table());
    List<DataRow> rows = dao.fetchRows(QueryBuilder.searchQuery(identifier, criteria));

    log.debug("Point search on {} with {} matched {} rows", identifier.name(),
        criteria.describe(), rows.size());

    PointSearch echoed = new PointSearch(identifier.name(), criteria.index(), criteria.date(),
        criteria.time(), criteria.value());
    return RowsResponse.success(rows, echoed.describe());
  }

  public RowsResponse range(Map<String, String> rawParams) {
    DateRange range = validator.validateRange(rawParams);
    TableIdentifier identifier = catalog.resolve(range.table());
    List<DataRow> rows = dao.fetchRows(QueryBuilder.rangeQuery(identifier, range));

    log.debug("Range {}..{} on {} returned {} rows", range.start(), range.end(),
        identifier.name(), rows.size());

    DateRange echoed = new DateRange(identifier.name(), range.start(), range.end());
    return RowsResponse.success(rows, echoed.describe());
  }
}
