/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.cli.ackl;


/**
 * Inclusive record id range argument. Parsed from one of
 * <ul>
 * <li>{@code n} (a single id),</li>
 * <li>{@code a-b} (ids {@code a} thru {@code b}),</li>
 * <li>{@code a-} (ids {@code a} thru the tail).</li>
 * </ul>
 * An open-ended range has {@code toId} equal to {@code Long.MAX_VALUE}.
 */
record IdRange(long fromId, long toId) {

  final static IdRange ALL = new IdRange(1, Long.MAX_VALUE);

  IdRange {
    if (fromId < 1)
      throw new IllegalArgumentException("ids start at 1: " + fromId);
    if (toId < fromId)
      throw new IllegalArgumentException(
          "range end (%d) < range start (%d)".formatted(toId, fromId));
  }


  static IdRange parse(String arg) {
    String ids = arg.strip();
    int dash = ids.indexOf('-');
    if (dash == -1) {
      long id = parseId(ids, arg);
      return new IdRange(id, id);
    }
    long from = parseId(ids.substring(0, dash), arg);
    String tail = ids.substring(dash + 1).strip();
    long to = tail.isEmpty() ? Long.MAX_VALUE : parseId(tail, arg);
    return new IdRange(from, to);
  }


  private static long parseId(String id, String arg) {
    try {
      return Long.parseLong(id.strip());
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException("illegal id range: " + arg);
    }
  }

}
