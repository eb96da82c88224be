/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Ledger configuration: database connection, table, and signing key.
 * 
 * @see LedgerConfig
 */
package io.crums.ackl.sql.config;
