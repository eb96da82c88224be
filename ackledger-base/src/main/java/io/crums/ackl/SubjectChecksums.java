/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.util.Optional;

/**
 * Looks up the current checksum of a subject (document). Implemented by
 * whatever owns document metadata.
 * 
 * @see ChainBuilder
 */
@FunctionalInterface
public interface SubjectChecksums {
  
  /** Knows no subjects. */
  public final static SubjectChecksums NONE = subjectId -> Optional.empty();
  
  
  /**
   * Returns the subject's current checksum, or empty if the subject is not
   * found (or has no checksum on record).
   */
  Optional<String> currentChecksum(String subjectId);

}
