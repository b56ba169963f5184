package com.github.obf.filter;

/**
 * Slots is the storage behind a {@link DoubleHashFilter}: a fixed-length array of small
 * unsigned values, all zero when new or cleared.
 * <p>
 * A filter writes the round index at each probed slot and later asks whether the slot
 * covers that round. What "covers" means is what distinguishes one filter variant from
 * another.
 */
interface Slots extends Cloneable {
  /** The current value of a slot. */
  int Read(long slot);

  /**
   * Record that <code>round</code> probed <code>slot</code>.
   *
   * @return true if the stored value changed
   */
  boolean Write(long slot, int round);

  /** Whether a lookup at <code>round</code> that lands on <code>slot</code> passes. */
  boolean Covers(long slot, int round);

  void Clear();

  long sizeInBytes();

  Slots clone();
}
