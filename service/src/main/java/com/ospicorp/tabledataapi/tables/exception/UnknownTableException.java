package com.ospicorp.tabledataapi.tables.exception;

public class UnknownTableException extends TableDataException {
  private final String table;

  public UnknownTableException(String table) {
    super("Unknown table", "Table '" + table + "' is not available", null);
    this.table = table;
  }

  public String table() {
    return table;
  }

  @Override
  public boolean clientFault() {
    return true;
  }
}
