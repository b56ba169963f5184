package com.github.obf.filter;

import com.google.common.base.Preconditions;

/**
 * Sizing is the classic Bloom filter capacity plan: the number of slots and the number of
 * hash rounds needed to hold <code>ndv</code> distinct values with a false positive
 * probability of about <code>fpp</code>.
 * <p>
 * Both filter variants size themselves this way; they differ only in what a slot holds.
 */
public final class Sizing {
  private static final double LN2 = Math.log(2);

  private final long slotCount;
  private final int hashRoundCount;

  private Sizing(long slotCount, int hashRoundCount) {
    this.slotCount = slotCount;
    this.hashRoundCount = hashRoundCount;
  }

  /**
   * Calculates the number of slots and hash rounds needed to store <code>ndv</code>
   * distinct values with a false positive probability of <code>fpp</code>.
   * <p>
   * <code>slotCount = ceil(-(ndv * ln(fpp)) / ln(2)^2)</code>, and
   * <code>hashRoundCount = round(slotCount / ndv * ln(2))</code>.
   *
   * @param fpp the desired false positive probability, strictly between 0 and 1
   * @param ndv the number of distinct values, at least 1
   * @throws IllegalArgumentException if either parameter is out of range
   */
  public static Sizing Compute(double fpp, long ndv) {
    // written so that NaN fails too
    Preconditions.checkArgument(fpp > 0 && fpp < 1,
        "false positive probability must be in (0, 1), got %s", fpp);
    Preconditions.checkArgument(ndv > 0, "ndv must be positive, got %s", ndv);

    long slots = (long) Math.ceil(-(ndv * Math.log(fpp) / (LN2 * LN2)));
    double factor = (double) slots / (double) ndv;
    long rounds = Math.round(factor * LN2);
    Preconditions.checkArgument(rounds <= Integer.MAX_VALUE,
        "%s hash rounds is too many", rounds);
    return new Sizing(slots, (int) rounds);
  }

  /**
   * Rejects sizings whose round index would not fit in a slot of a variant.
   *
   * @param maxRounds the largest round index a slot can store
   * @throws IllegalArgumentException if <code>hashRoundCount</code> exceeds it
   */
  Sizing CheckRounds(int maxRounds) {
    Preconditions.checkArgument(hashRoundCount <= maxRounds,
        "%s hash rounds exceed the slot value limit of %s", hashRoundCount, maxRounds);
    return this;
  }

  /**
   * Rejects sizings with more slots than the backing array of a variant can address.
   *
   * @param maxSlots the largest slot count that can be allocated
   * @throws IllegalArgumentException if <code>slotCount</code> exceeds it
   */
  Sizing CheckSlots(long maxSlots) {
    Preconditions.checkArgument(slotCount <= maxSlots,
        "%s slots exceed the limit of %s", slotCount, maxSlots);
    return this;
  }

  public long slotCount() { return slotCount; }

  public int hashRoundCount() { return hashRoundCount; }

  @Override
  public boolean equals(Object there) {
    if (there == null) return false;
    if (!(there instanceof Sizing)) return false;
    Sizing that = (Sizing) there;
    return slotCount == that.slotCount && hashRoundCount == that.hashRoundCount;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(slotCount) + hashRoundCount;
  }

  @Override
  public String toString() {
    return "Sizing{slots=" + slotCount + ", rounds=" + hashRoundCount + "}";
  }
}
