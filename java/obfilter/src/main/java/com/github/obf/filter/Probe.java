package com.github.obf.filter;

// Double hashing: round i of a hash (lo, hi) lands on (lo + i * hi) mod slotCount. All
// arithmetic is on unsigned 64-bit words, so the sum and product wrap before the
// reduction.
final class Probe {
  private Probe() {}

  static long Index(long lo, long hi, long round, long slotCount) {
    return Long.remainderUnsigned(lo + round * hi, slotCount);
  }
}
