/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * JDBC connection parameters.
 */
public record DbConnection(
    String url, Optional<String> driverClass, Optional<DbCredentials> creds) {
  
  /**
   * 
   * @param url         jdbc URL. For eg, {@code jdbc:postgresql://localhost:5432/ackl}
   * @param driverClass fully qualified driver class name
   * @param creds       connection credentials (username / password)
   */
  public DbConnection {
    
    try {
      URI uri = new URI(url);
      if (!"jdbc".equals(uri.getScheme()))
        throw new IllegalArgumentException(
            "connection URL must use 'jdbc' scheme; " + url);
    } catch (URISyntaxException usx) {
      var detail = usx.getMessage();
      throw new IllegalArgumentException(
          "malformed url: %s%nDetail: %s"
          .formatted(url, detail == null ? "" : detail),
          usx);
    }
    if (driverClass == null || driverClass.filter(String::isEmpty).isPresent())
      driverClass = Optional.empty();
    
    if (creds == null)
      creds = Optional.empty();
  }
  
  
  /**
   * 
   * @param url         jdbc URL
   * @param driverClass fully qualified driver class name, or {@code null}
   * @param creds       may be {@code null}
   */
  public DbConnection(
      String url, String driverClass, DbCredentials creds) {
    this(
        url,
        Optional.ofNullable(driverClass),
        Optional.ofNullable(creds));
  }
  
  
  /**
   * Creates an instance with no driver class and no credentials.
   */
  public DbConnection(String url) {
    this(url, Optional.empty(), Optional.empty());
  }

}
