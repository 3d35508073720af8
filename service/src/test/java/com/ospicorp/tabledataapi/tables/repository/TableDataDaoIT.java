package com.ospicorp.tabledataapi.tables.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tabledataapi.tables.exception.QueryExecutionException;
import com.ospicorp.tabledataapi.tables.model.AggregationFunction;
import com.ospicorp.tabledataapi.tables.model.BuiltQuery;
import com.ospicorp.tabledataapi.tables.model.DataRow;
import com.ospicorp.tabledataapi.tables.model.DateRange;
import com.ospicorp.tabledataapi.tables.model.PointSearch;
import com.ospicorp.tabledataapi.tables.model.QueryParameters;
import com.ospicorp.tabledataapi.tables.model.TableIdentifier;
import com.ospicorp.tabledataapi.tables.model.TableStatistics;
import com.ospicorp.tabledataapi.tables.model.TableSummary;
import com.ospicorp.tabledataapi.tables.service.QueryBuilder;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class TableDataDaoIT {

  private static final TableIdentifier SENSOR1 = new TableIdentifier("public", "sensor1");
  private static final TableIdentifier SENSOR2 = new TableIdentifier("public", "sensor2");

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
      .withInitScript("test-init-tables.sql");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    POSTGRES.start();
    registry.add("spring.datasource.url", () -> POSTGRES.getJdbcUrl() + "&stringtype=unspecified");
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  private TableDataDao dao;

  @Test
  void minPicksSmallestReadingPerTriple() {
    var params = new QueryParameters("sensor1", "2024-01-03", AggregationFunction.MIN);

    List<DataRow> rows = dao.fetchRows(QueryBuilder.rowQuery(SENSOR1, params));

    assertThat(rows).hasSize(4);
    assertThat(rows.get(0).value()).isEqualByComparingTo(new BigDecimal("3"));
  }

  @Test
  void statisticsCoverAllRawRows() {
    var params = new QueryParameters("sensor1", "2024-01-03", AggregationFunction.MAX);

    TableStatistics stats = dao.fetchStatistics(QueryBuilder.statisticsQuery(SENSOR1, params));

    assertThat(stats.count()).isEqualTo(5);
    assertThat(stats.minValue()).isEqualByComparingTo("3");
    assertThat(stats.maxValue()).isEqualByComparingTo("12");
    assertThat(stats.avgValue()).isEqualByComparingTo("6.3");
  }

  @Test
  void listsBaseTablesOfSchema() {
    assertThat(dao.listTableNames("public"))
        .containsExactlyInAnyOrder("sensor1", "sensor2", "Audit_Log");
  }

  @Test
  void summaryIgnoresEmptyDates() {
    TableSummary summary = dao.summarize(SENSOR2, 1);

    assertThat(summary.totalRows()).isEqualTo(2);
    assertThat(summary.uniqueIndices()).isEqualTo(1);
    assertThat(summary.minDate()).isEqualTo("2024-01-01");
    assertThat(summary.preview()).hasSize(1);
  }

  @Test
  void missingTableSurfacesAsQueryError() {
    var missing = new TableIdentifier("public", "sensor404");
    var params = new QueryParameters("sensor404", "2024-01-01", AggregationFunction.RAW);

    assertThatThrownBy(() -> dao.fetchRows(QueryBuilder.rowQuery(missing, params)))
        .isInstanceOf(QueryExecutionException.class)
        .hasMessage("Processing error")
        .extracting(ex -> ((QueryExecutionException) ex).details())
        .asString()
        .contains("sensor404");
  }

  @Test
  void rawQueryBindsDateAsValue() {
    var params = new QueryParameters("sensor1", "2024-01-01' OR '1'='1", AggregationFunction.RAW);

    BuiltQuery query = QueryBuilder.rowQuery(SENSOR1, params);

    assertThat(dao.fetchRows(query)).isEmpty();
  }

  @Test
  void searchBindsTypedCriteriaAgainstTextColumns() {
    var search = new PointSearch("sensor1", "2", LocalDate.of(2024, 1, 3), LocalTime.of(0, 10),
        new BigDecimal("12"));

    List<DataRow> rows = dao.fetchRows(QueryBuilder.searchQuery(SENSOR1, search));

    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).index()).isEqualTo("2");
    assertThat(rows.get(0).time()).isEqualTo("00:10:00");
  }

  @Test
  void searchBindsTypedCriteriaAgainstTypedColumns() {
    var search = new PointSearch("sensor2", null, LocalDate.of(2024, 1, 1), LocalTime.of(12, 0),
        new BigDecimal("2.5"));

    List<DataRow> rows = dao.fetchRows(QueryBuilder.searchQuery(SENSOR2, search));

    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).value()).isEqualByComparingTo("2.5");
  }

  @Test
  void rangeSpansSeveralDays() {
    var range = new DateRange("sensor1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));

    List<DataRow> rows = dao.fetchRows(QueryBuilder.rangeQuery(SENSOR1, range));

    assertThat(rows).hasSize(8);
    assertThat(rows.get(0).date()).isEqualTo("2024-01-01");
    assertThat(rows.get(rows.size() - 1).date()).isEqualTo("2024-01-03");
    assertThat(rows.get(rows.size() - 1).time()).isEqualTo("00:10:00");
  }
}
