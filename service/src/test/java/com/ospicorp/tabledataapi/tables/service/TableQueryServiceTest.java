package com.ospicorp.tabledataapi.tables.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ospicorp.tabledataapi.tables.exception.InvalidParameterException;
import com.ospicorp.tabledataapi.tables.exception.MissingParameterException;
import com.ospicorp.tabledataapi.tables.exception.QueryExecutionException;
import com.ospicorp.tabledataapi.tables.exception.UnknownTableException;
import com.ospicorp.tabledataapi.tables.model.BuiltQuery;
import com.ospicorp.tabledataapi.tables.model.DataRow;
import com.ospicorp.tabledataapi.tables.model.RowsResponse;
import com.ospicorp.tabledataapi.tables.model.TableDataResponse;
import com.ospicorp.tabledataapi.tables.model.TableIdentifier;
import com.ospicorp.tabledataapi.tables.model.TableStatistics;
import com.ospicorp.tabledataapi.tables.model.TableSummary;
import com.ospicorp.tabledataapi.tables.repository.TableDataDao;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataRetrievalFailureException;

class TableQueryServiceTest {

  private static final TableStatistics STATS = new TableStatistics(2, new BigDecimal("10"),
      new BigDecimal("20"), new BigDecimal("15"));

  private TableDataDao dao;
  private TableQueryService service;

  @BeforeEach
  void setUp() {
    dao = mock(TableDataDao.class);
    TableCatalog catalog = new TableCatalog(dao, List.of("sensor1"), false, "public");
    service = new TableQueryService(new ParameterValidator(false), catalog, dao, 5);
  }

  @Test
  void queryRunsRowsThenStatisticsAndEchoesMetadata() {
    List<DataRow> rows = List.of(new DataRow("1", "2024-01-01", "00:00", new BigDecimal("15")));
    when(dao.fetchRows(any())).thenReturn(rows);
    when(dao.fetchStatistics(any())).thenReturn(STATS);

    TableDataResponse response = service.query(
        Map.of("table", "Sensor1", "date", "2024-01-01", "function", "average"));

    assertThat(response.status()).isEqualTo("success");
    assertThat(response.data()).isEqualTo(rows);
    assertThat(response.statistics()).isEqualTo(STATS);
    assertThat(response.metadata().table()).isEqualTo("sensor1");
    assertThat(response.metadata().date()).isEqualTo("2024-01-01");
    assertThat(response.metadata().function()).isEqualTo("average");

    ArgumentCaptor<BuiltQuery> rowQuery = ArgumentCaptor.forClass(BuiltQuery.class);
    verify(dao).fetchRows(rowQuery.capture());
    assertThat(rowQuery.getValue().sql()).contains("AVG(", "GROUP BY");
    assertThat(rowQuery.getValue().parameters()).containsExactly("2024-01-01");
  }

  @Test
  void unknownFunctionIsReportedAsRaw() {
    when(dao.fetchRows(any())).thenReturn(List.of());
    when(dao.fetchStatistics(any())).thenReturn(STATS);

    TableDataResponse response = service.query(
        Map.of("table", "sensor1", "date", "2024-01-01", "function", "bogus"));

    assertThat(response.metadata().function()).isEqualTo("raw");
    ArgumentCaptor<BuiltQuery> rowQuery = ArgumentCaptor.forClass(BuiltQuery.class);
    verify(dao).fetchRows(rowQuery.capture());
    assertThat(rowQuery.getValue().sql()).doesNotContain("GROUP BY");
  }

  @Test
  void missingParametersNeverReachTheDatabase() {
    assertThatThrownBy(() -> service.query(Map.of("date", "2024-01-01")))
        .isInstanceOf(MissingParameterException.class);
    assertThatThrownBy(() -> service.query(Map.of("table", "sensor1")))
        .isInstanceOf(MissingParameterException.class);

    verifyNoInteractions(dao);
  }

  @Test
  void unknownTableNeverReachesTheDatabase() {
    assertThatThrownBy(() -> service.query(Map.of("table", "users", "date", "2024-01-01")))
        .isInstanceOf(UnknownTableException.class);

    verifyNoInteractions(dao);
  }

  @Test
  void rowQueryFailureSkipsStatistics() {
    when(dao.fetchRows(any()))
        .thenThrow(new QueryExecutionException(new DataRetrievalFailureException("boom")));

    assertThatThrownBy(() -> service.query(Map.of("table", "sensor1", "date", "2024-01-01")))
        .isInstanceOf(QueryExecutionException.class)
        .hasMessage("Processing error");

    verify(dao, never()).fetchStatistics(any());
  }

  @Test
  void summarizeResolvesTableAndAppliesPreviewLimit() {
    TableSummary summary = new TableSummary("sensor1", 0, 0, null, null, List.of());
    when(dao.summarize(any(), eq(5))).thenReturn(summary);

    assertThat(service.summarize(" sensor1 ")).isSameAs(summary);
    verify(dao).summarize(new TableIdentifier("public", "sensor1"), 5);
  }

  @Test
  void listTablesComesFromCatalog() {
    assertThat(service.listTables()).containsExactly("sensor1");
  }

  @Test
  void searchEchoesCanonicalTableAndNormalizedCriteria() {
    List<DataRow> rows = List.of(new DataRow("1", "2024-01-03", "00:00:00", new BigDecimal("3")));
    when(dao.fetchRows(any())).thenReturn(rows);

    RowsResponse response = service.search("SENSOR1", Map.of("date", "2024-01-03", "time", "00:00"));

    assertThat(response.status()).isEqualTo("success");
    assertThat(response.data()).isEqualTo(rows);
    assertThat(response.metadata())
        .containsExactly(Map.entry("table", "sensor1"), Map.entry("date", "2024-01-03"),
            Map.entry("time", "00:00:00"));

    ArgumentCaptor<BuiltQuery> query = ArgumentCaptor.forClass(BuiltQuery.class);
    verify(dao).fetchRows(query.capture());
    assertThat(query.getValue().sql()).contains("FROM \"public\".\"sensor1\"");
    assertThat(query.getValue().parameters())
        .containsExactly(LocalDate.of(2024, 1, 3), LocalTime.of(0, 0));
    verify(dao, never()).fetchStatistics(any());
  }

  @Test
  void searchOnUnknownTableNeverReachesTheDatabase() {
    assertThatThrownBy(() -> service.search("users", Map.of()))
        .isInstanceOf(UnknownTableException.class);

    verifyNoInteractions(dao);
  }

  @Test
  void rangeRunsOneBoundQuery() {
    when(dao.fetchRows(any())).thenReturn(List.of());

    RowsResponse response = service.range(
        Map.of("table", "sensor1", "start", "2024-01-01", "end", "2024-01-03"));

    assertThat(response.data()).isEmpty();
    assertThat(response.metadata())
        .containsEntry("table", "sensor1")
        .containsEntry("start", "2024-01-01")
        .containsEntry("end", "2024-01-03");
    ArgumentCaptor<BuiltQuery> query = ArgumentCaptor.forClass(BuiltQuery.class);
    verify(dao).fetchRows(query.capture());
    assertThat(query.getValue().sql()).contains("BETWEEN ? AND ?");
  }

  @Test
  void invalidRangeNeverReachesTheDatabase() {
    assertThatThrownBy(() -> service.range(
        Map.of("table", "sensor1", "start", "2024-03-01", "end", "2024-01-01")))
        .isInstanceOf(InvalidParameterException.class);

    verifyNoInteractions(dao);
  }
}
