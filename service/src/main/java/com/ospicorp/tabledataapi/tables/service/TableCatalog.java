package com.ospicorp.tabledataapi.tables.service;

import com.ospicorp.tabledataapi.tables.exception.UnknownTableException;
import com.ospicorp.tabledataapi.tables.model.TableIdentifier;
import com.ospicorp.tabledataapi.tables.repository.TableDataDao;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Allow-list of tables the API may read.
 *
 * <p>Tables come from {@code tabledata.tables.allowed}, from the database catalog when
 * {@code tabledata.tables.discover} is on, or from both (intersection). Lookups are
 * case-insensitive.
 */
@Component
public class TableCatalog {
  private static final Logger log = LoggerFactory.getLogger(TableCatalog.class);
  private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

  private final TableDataDao dao;
  private final Map<String, String> allowed;
  private final boolean discover;
  private final String schema;

  public TableCatalog(TableDataDao dao,
      @Value("${tabledata.tables.allowed:}") List<String> allowed,
      @Value("${tabledata.tables.discover:true}") boolean discover,
      @Value("${tabledata.tables.schema:public}") String schema) {
    this.dao = dao;
    this.discover = discover;
    this.schema = schema;
    this.allowed = new TreeMap<>();
    for (String name : allowed) {
      if (!StringUtils.hasText(name)) {
        continue;
      }
      String trimmed = name.trim();
      if (!TABLE_NAME.matcher(trimmed).matches()) {
        throw new IllegalArgumentException("Invalid table name in tabledata.tables.allowed: " + trimmed);
      }
      this.allowed.put(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
    if (this.allowed.isEmpty() && !discover) {
      log.warn("No tables configured and discovery disabled; every query will be rejected");
    }
  }

  public TableIdentifier resolve(String table) {
    if (table == null || !TABLE_NAME.matcher(table).matches()) {
      throw new UnknownTableException(table);
    }
    String canonical = queryable().get(table.toLowerCase(Locale.ROOT));
    if (canonical == null) {
      throw new UnknownTableException(table);
    }
    return new TableIdentifier(schema, canonical);
  }

  public List<String> listTables() {
    return Collections.unmodifiableList(new ArrayList<>(queryable().values()));
  }

  private Map<String, String> queryable() {
    if (!discover) {
      return allowed;
    }
    Map<String, String> discovered = new TreeMap<>();
    for (String name : dao.listTableNames(schema)) {
      if (TABLE_NAME.matcher(name).matches()) {
        discovered.put(name.toLowerCase(Locale.ROOT), name);
      }
    }
    if (!allowed.isEmpty()) {
      discovered.keySet().retainAll(allowed.keySet());
    }
    return discovered;
  }
}
