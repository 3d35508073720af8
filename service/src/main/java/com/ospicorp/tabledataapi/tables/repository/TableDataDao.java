package com.ospicorp.tabledataapi.tables.repository;

import com.ospicorp.tabledataapi.tables.exception.DatabaseConnectionException;
import com.ospicorp.tabledataapi.tables.exception.QueryExecutionException;
import com.ospicorp.tabledataapi.tables.model.BuiltQuery;
import com.ospicorp.tabledataapi.tables.model.DataRow;
import com.ospicorp.tabledataapi.tables.model.TableIdentifier;
import com.ospicorp.tabledataapi.tables.model.TableStatistics;
import com.ospicorp.tabledataapi.tables.model.TableSummary;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class TableDataDao {
  private static final RowMapper<DataRow> DATA_ROW = TableDataDao::mapDataRow;

  private final JdbcTemplate jdbc;

  public TableDataDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public List<DataRow> fetchRows(BuiltQuery query) {
    return translate(() -> jdbc.query(query.sql(), DATA_ROW, query.parameterArray()));
  }

  public TableStatistics fetchStatistics(BuiltQuery query) {
    return translate(() -> jdbc.queryForObject(query.sql(),
        (rs, i) -> new TableStatistics(rs.getLong("count"),
                                       rs.getBigDecimal("min_value"),
                                       rs.getBigDecimal("max_value"),
                                       rs.getBigDecimal("avg_value")),
        query.parameterArray()));
  }

  public List<String> listTableNames(String schema) {
    String sql = """
      SELECT table_name
      FROM information_schema.tables
      WHERE table_schema = ? AND table_type = 'BASE TABLE'
      ORDER BY table_name
    """;
    return translate(() -> jdbc.queryForList(sql, String.class, schema));
  }

  public TableSummary summarize(TableIdentifier table, int previewLimit) {
    String counts = "SELECT COUNT(*) AS total_rows, COUNT(DISTINCT \"index\") AS unique_indices FROM "
        + table.sql();
    String dateRange = "SELECT MIN(\"date\")::text AS min_date, MAX(\"date\")::text AS max_date FROM "
        + table.sql() + " WHERE \"date\" IS NOT NULL AND \"date\"::text <> ''";
    String preview = "SELECT \"index\", \"date\", \"time\", \"value\"::numeric AS \"value\" FROM "
        + table.sql() + " ORDER BY \"date\", \"time\", \"index\" LIMIT ?";

    return translate(() -> {
      long[] totals = jdbc.queryForObject(counts,
          (rs, i) -> new long[] {rs.getLong("total_rows"), rs.getLong("unique_indices")});
      String[] range = jdbc.queryForObject(dateRange,
          (rs, i) -> new String[] {rs.getString("min_date"), rs.getString("max_date")});
      List<DataRow> rows = jdbc.query(preview, DATA_ROW, previewLimit);
      return new TableSummary(table.name(), totals[0], totals[1], range[0], range[1], rows);
    });
  }

  private static DataRow mapDataRow(ResultSet rs, int rowNum) throws SQLException {
    return new DataRow(rs.getObject("index"),
                       rs.getString("date"),
                       rs.getString("time"),
                       rs.getBigDecimal("value"));
  }

  private static <T> T translate(Supplier<T> call) {
    try {
      return call.get();
    } catch (CannotGetJdbcConnectionException ex) {
      throw new DatabaseConnectionException(ex);
    } catch (DataAccessException ex) {
      if (isConnectionFailure(ex)) {
        throw new DatabaseConnectionException(ex);
      }
      throw new QueryExecutionException(ex);
    } catch (RuntimeException ex) {
      // pool start-up failures arrive unwrapped
      if (isConnectionFailure(ex)) {
        throw new DatabaseConnectionException(ex);
      }
      throw ex;
    }
  }

  // SQLState class 08 is "connection exception"
  private static boolean isConnectionFailure(Throwable ex) {
    for (Throwable t = ex; t != null && t.getCause() != t; t = t.getCause()) {
      if (t instanceof SQLTransientConnectionException) {
        return true;
      }
      if (t instanceof SQLException sql && sql.getSQLState() != null
          && sql.getSQLState().startsWith("08")) {
        return true;
      }
    }
    return false;
  }
}
