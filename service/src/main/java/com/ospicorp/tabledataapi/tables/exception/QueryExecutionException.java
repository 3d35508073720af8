package com.ospicorp.tabledataapi.tables.exception;

public class QueryExecutionException extends DatabaseException {

  public QueryExecutionException(Throwable cause) {
    super("Processing error", cause);
  }
}
