package com.ospicorp.tabledataapi.tables.model;

public record QueryMetadata(String table, String date, String function) {}
