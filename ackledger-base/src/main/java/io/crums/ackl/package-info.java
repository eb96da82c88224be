/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Signed, hash-chained acknowledgment ledger.
 * 
 * <h2>Overview</h2>
 * <p>
 * An {@linkplain io.crums.ackl.AttestationFact AttestationFact} (who
 * acknowledged which document, when) is
 * {@linkplain io.crums.ackl.CanonicalEncoder canonically encoded}, hashed,
 * signed by the {@linkplain io.crums.ackl.KeyCustodian KeyCustodian}, and
 * linked to the tail of the ledger by the
 * {@linkplain io.crums.ackl.ChainBuilder ChainBuilder}. The
 * {@linkplain io.crums.ackl.ChainVerifier ChainVerifier} replays the chain
 * using only the public key.
 * </p>
 * 
 * @see io.crums.ackl.LedgerStore
 */
package io.crums.ackl;
