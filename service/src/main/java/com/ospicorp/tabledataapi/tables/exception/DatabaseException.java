package com.ospicorp.tabledataapi.tables.exception;

public abstract class DatabaseException extends TableDataException {

  protected DatabaseException(String message, Throwable cause) {
    super(message, driverMessage(cause), cause);
  }

  @Override
  public boolean clientFault() {
    return false;
  }

  private static String driverMessage(Throwable cause) {
    if (cause == null) {
      return null;
    }
    Throwable root = cause;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getMessage() != null ? root.getMessage() : cause.getMessage();
  }
}
