/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql;


import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

import org.h2.tools.TriggerAdapter;

/**
 * H2 {@code BEFORE UPDATE} row trigger that rejects any change to the
 * {@code created_at} column.
 * 
 * @see LedgerSchema#getTriggerSchema()
 */
public class CreatedAtGuard extends TriggerAdapter {
  
  public final static String MESSAGE = "Cannot modify created_at timestamp";
  
  
  @Override
  public void fire(Connection conn, ResultSet oldRow, ResultSet newRow) throws SQLException {
    if (oldRow == null || newRow == null)
      return;
    
    Object before = oldRow.getObject(LedgerSchema.CREATED_AT);
    Object after = newRow.getObject(LedgerSchema.CREATED_AT);
    if (!Objects.equals(before, after))
      throw new SQLException(
          MESSAGE + " (" + tableName + " " + LedgerSchema.ID + "=" +
          oldRow.getObject(LedgerSchema.ID) + ")", "45000");
  }

}
