package com.github.obf.filter;

import java.util.Arrays;

// One bit per slot. Any write sets the bit; any set bit covers any round.
final class BitSlots implements Slots {
  static final long MAX_SLOTS = 64L * (Integer.MAX_VALUE - 8);

  private final long[] words;

  BitSlots(long length) {
    this(new long[(int) ((length + 63) >>> 6)]);
  }

  private BitSlots(long[] words) {
    this.words = words;
  }

  @Override
  public int Read(long slot) {
    return (int) ((words[(int) (slot >>> 6)] >>> slot) & 1);
  }

  @Override
  public boolean Write(long slot, int round) {
    int idx = (int) (slot >>> 6);
    long before = words[idx];
    words[idx] = before | (1L << slot);
    return before != words[idx];
  }

  @Override
  public boolean Covers(long slot, int round) {
    return 0 != (words[(int) (slot >>> 6)] & (1L << slot));
  }

  @Override
  public void Clear() {
    Arrays.fill(words, 0L);
  }

  /** The number of set bits. */
  long Count() {
    long result = 0;
    for (long w : words) {
      result += Long.bitCount(w);
    }
    return result;
  }

  @Override
  public long sizeInBytes() { return words.length * 8L; }

  @Override
  public BitSlots clone() {
    return new BitSlots(words.clone());
  }

  @Override
  public boolean equals(Object there) {
    if (there == null) return false;
    if (!(there instanceof BitSlots)) return false;
    BitSlots that = (BitSlots) there;
    return Arrays.equals(words, that.words);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(words);
  }
}
