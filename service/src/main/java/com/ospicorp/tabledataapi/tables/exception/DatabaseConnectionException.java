package com.ospicorp.tabledataapi.tables.exception;

public class DatabaseConnectionException extends DatabaseException {

  public DatabaseConnectionException(Throwable cause) {
    super("Database connection failed", cause);
  }
}
