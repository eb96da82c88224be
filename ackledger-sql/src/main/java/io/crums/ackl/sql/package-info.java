/*
 * Copyright 2026 Babak Farhang
 */
/**
 * SQL (JDBC) backed {@linkplain io.crums.ackl.LedgerStore}.
 * 
 * @see SqlLedgerStore
 * @see LedgerSchema
 */
package io.crums.ackl.sql;
