package com.ospicorp.tabledataapi.tables.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;

// index keeps whatever type the column has (integer or text); date and time are passed through as text
@JsonPropertyOrder({"index", "date", "time", "value"})
public record DataRow(Object index, String date, String time, BigDecimal value) {}
