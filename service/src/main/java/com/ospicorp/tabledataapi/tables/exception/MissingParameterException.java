package com.ospicorp.tabledataapi.tables.exception;

public class MissingParameterException extends TableDataException {
  private final String parameter;

  public MissingParameterException(String parameter) {
    super("Parameter '" + parameter + "' is missing or empty", null, null);
    this.parameter = parameter;
  }

  public String parameter() {
    return parameter;
  }

  @Override
  public boolean clientFault() {
    return true;
  }
}
