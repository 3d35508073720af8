package com.ospicorp.tabledataapi.tables.model;

// Validated and defaulted request input; table is the sanitized name, not yet allow-list resolved
public record QueryParameters(String table, String date, AggregationFunction function) {}
