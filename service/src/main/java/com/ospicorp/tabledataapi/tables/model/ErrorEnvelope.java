package com.ospicorp.tabledataapi.tables.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record ErrorEnvelope(String error, String details, String status) {

  public static ErrorEnvelope of(String error, String details) {
    return new ErrorEnvelope(error, details, "error");
  }
}
