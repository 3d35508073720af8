package com.ospicorp.tabledataapi.tables.model;

import java.util.List;

public record BuiltQuery(String sql, List<Object> parameters) {

  public Object[] parameterArray() {
    return parameters.toArray();
  }
}
