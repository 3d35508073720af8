package com.ospicorp.tabledataapi.tables.exception;

/**
 * Base type for failures that are reported to clients through the error envelope.
 *
 * <p>{@link #error()} is the human-readable headline, {@link #details()} the underlying cause text
 * (may be {@code null}).
 */
public abstract class TableDataException extends RuntimeException {
  private final String details;

  protected TableDataException(String message, String details, Throwable cause) {
    super(message, cause);
    this.details = details;
  }

  public String error() {
    return getMessage();
  }

  public String details() {
    return details;
  }

  /** Whether the request itself was at fault, as opposed to the database or the service. */
  public abstract boolean clientFault();
}
