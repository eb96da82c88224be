/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JSON renditions of ledger records and verification reports.
 * Uses <em>json-simple</em>.
 */
package io.crums.ackl.json;
