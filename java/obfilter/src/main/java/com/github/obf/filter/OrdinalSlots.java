package com.github.obf.filter;

import java.util.Arrays;

// One unsigned byte per slot, holding the largest round index that ever probed it. A
// slot covers a round if it holds at least that round.
final class OrdinalSlots implements Slots {
  static final int MAX_ROUND = 0xff;
  static final long MAX_SLOTS = Integer.MAX_VALUE - 8;

  private final byte[] values;

  OrdinalSlots(long length) {
    this(new byte[(int) length]);
  }

  private OrdinalSlots(byte[] values) {
    this.values = values;
  }

  @Override
  public int Read(long slot) {
    return Byte.toUnsignedInt(values[(int) slot]);
  }

  @Override
  public boolean Write(long slot, int round) {
    if (Read(slot) < round) {
      values[(int) slot] = (byte) round;
      return true;
    }
    return false;
  }

  @Override
  public boolean Covers(long slot, int round) {
    return Read(slot) >= round;
  }

  @Override
  public void Clear() {
    Arrays.fill(values, (byte) 0);
  }

  /**
   * Fills <code>counts[v]</code> with the number of slots holding a value of at least
   * <code>v</code>, for every <code>v</code> that fits in <code>counts</code>.
   */
  void AtLeast(long[] counts) {
    Arrays.fill(counts, 0L);
    for (byte b : values) {
      int v = Math.min(Byte.toUnsignedInt(b), counts.length - 1);
      ++counts[v];
    }
    // suffix sums
    for (int v = counts.length - 2; v >= 0; --v) {
      counts[v] += counts[v + 1];
    }
  }

  @Override
  public long sizeInBytes() { return values.length; }

  @Override
  public OrdinalSlots clone() {
    return new OrdinalSlots(values.clone());
  }

  @Override
  public boolean equals(Object there) {
    if (there == null) return false;
    if (!(there instanceof OrdinalSlots)) return false;
    OrdinalSlots that = (OrdinalSlots) there;
    return Arrays.equals(values, that.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }
}
