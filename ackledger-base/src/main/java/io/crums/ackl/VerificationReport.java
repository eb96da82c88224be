/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import io.crums.ackl.Discrepancy.Kind;

/**
 * Outcome of replaying the chain over a range of record ids. Lists
 * <em>every</em> discrepancy found, in ascending record id order.
 * 
 * @param fromId          first id checked (inclusive)
 * @param toId            last id checked (inclusive)
 * @param recordsChecked  number of records replayed
 * @param discrepancies   all failures found (empty if none)
 * 
 * @see ChainVerifier
 */
public record VerificationReport(
    long fromId, long toId, long recordsChecked, List<Discrepancy> discrepancies) {
  
  public VerificationReport {
    if (recordsChecked < 0)
      throw new IllegalArgumentException("recordsChecked " + recordsChecked);
    discrepancies = List.copyOf(Objects.requireNonNull(discrepancies, "null discrepancies"));
  }
  
  
  /** Returns {@code true} iff no discrepancies were found. */
  public boolean isClean() {
    return discrepancies.isEmpty();
  }
  
  
  /**
   * Returns the ids of the records with discrepancies, in ascending order,
   * without duplicates.
   */
  public List<Long> failedIds() {
    return discrepancies.stream()
        .map(Discrepancy::recordId).distinct().sorted()
        .collect(Collectors.toList());
  }
  
  
  /**
   * Returns the discrepancies of the given kind.
   */
  public List<Discrepancy> ofKind(Kind kind) {
    return discrepancies.stream()
        .filter(d -> d.kind() == kind)
        .collect(Collectors.toList());
  }
  
  
  /**
   * Returns the discrepancies at the given record id.
   */
  public List<Discrepancy> at(long recordId) {
    return discrepancies.stream()
        .filter(d -> d.recordId() == recordId)
        .collect(Collectors.toList());
  }
  
  
  /**
   * Returns the first discrepancy's record id, or -1 if clean.
   */
  public long firstFailedId() {
    return isClean() ? -1L : discrepancies.get(0).recordId();
  }

}
