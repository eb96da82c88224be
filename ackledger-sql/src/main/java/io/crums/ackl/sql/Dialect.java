/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql;


import java.util.Locale;

/**
 * SQL dialects the DDL is written for. Queries and inserts are portable;
 * only the write-once trigger differs.
 */
public enum Dialect {
  /** Embedded H2. The trigger is the Java class {@linkplain CreatedAtGuard}. */
  H2,
  /** PostgreSQL. The trigger is a PL/pgSQL function. */
  POSTGRESQL;
  
  
  /**
   * Infers the dialect from the given JDBC URL.
   * 
   * @throws IllegalArgumentException if not a recognized URL
   */
  public static Dialect forUrl(String jdbcUrl) {
    String url = jdbcUrl.strip().toLowerCase(Locale.ROOT);
    if (url.startsWith("jdbc:h2:"))
      return H2;
    if (url.startsWith("jdbc:postgresql:"))
      return POSTGRESQL;
    throw new IllegalArgumentException("cannot infer SQL dialect from URL: " + jdbcUrl);
  }
  
  
  /**
   * Parses the given dialect name, case-insensitively.
   * 
   * @throws IllegalArgumentException if not recognized
   */
  public static Dialect forName(String name) {
    String n = name.strip().toUpperCase(Locale.ROOT);
    if (n.equals("POSTGRES") || n.equals("PG"))
      return POSTGRESQL;
    return valueOf(n);
  }

}
