package com.github.obf.filter;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.primitives.Longs;

// Splits a 128-bit HashCode into the two words MurmurHash3_x64_128 outputs. Guava lays
// them out little-endian, low word first.
final class Hashes {
  private Hashes() {}

  static long Low(HashCode hash) {
    CheckBits(hash);
    return hash.asLong();
  }

  static long High(HashCode hash) {
    CheckBits(hash);
    byte[] b = hash.asBytes();
    return Longs.fromBytes(b[15], b[14], b[13], b[12], b[11], b[10], b[9], b[8]);
  }

  private static void CheckBits(HashCode hash) {
    Preconditions.checkArgument(hash.bits() == 128,
        "expected a 128-bit hash, got %s bits", hash.bits());
  }
}
