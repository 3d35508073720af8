package com.ospicorp.tabledataapi.tables.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

public record TableStatistics(
    long count,
    @JsonProperty("min_value") BigDecimal minValue,
    @JsonProperty("max_value") BigDecimal maxValue,
    @JsonProperty("avg_value") BigDecimal avgValue
) {}
