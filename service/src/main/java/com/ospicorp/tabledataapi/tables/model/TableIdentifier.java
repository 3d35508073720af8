package com.ospicorp.tabledataapi.tables.model;

/**
 * A table name that passed the allow-list. Only instances of this type are ever rendered into SQL
 * text.
 */
public record TableIdentifier(String schema, String name) {

  public String sql() {
    return quote(schema) + "." + quote(name);
  }

  private static String quote(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}
