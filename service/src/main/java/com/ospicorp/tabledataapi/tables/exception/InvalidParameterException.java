package com.ospicorp.tabledataapi.tables.exception;

public class InvalidParameterException extends TableDataException {
  public static final int UNKNOWN_FUNCTION = 1001;
  public static final int INVALID_FORMAT = 1002;
  public static final int INVALID_DATE = 1003;
  public static final int INVALID_TIME = 1004;
  public static final int INVALID_VALUE = 1005;
  public static final int INVALID_RANGE = 1006;

  private final int errorCode;

  public InvalidParameterException(String message, int errorCode, String details) {
    super(message, details, null);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  @Override
  public boolean clientFault() {
    return true;
  }
}
