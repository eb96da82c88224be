/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql.config;

/**
 * Database credentials.
 */
public record DbCredentials(String username, String password) {
  
  /**
   * Full constructor.
   * 
   * @param username    not empty
   * @param password    not {@code null}; may be empty
   */
  public DbCredentials {
    if (username.isEmpty())
      throw new IllegalArgumentException("empty username");
    if (password == null)
      password = "";
  }
  
  
  /** Masks the password. */
  @Override
  public String toString() {
    return "DbCredentials[username=" + username + ", password=****]";
  }

}
