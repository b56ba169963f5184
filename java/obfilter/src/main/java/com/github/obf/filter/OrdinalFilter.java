package com.github.obf.filter;

import com.google.common.base.Preconditions;

/**
 * OrdinalFilter is a Bloom filter whose slots remember <em>which</em> round set them.
 * <p>
 * Rounds are numbered from one. Adding an element raises the slot probed by round
 * <code>i</code> to at least <code>i</code>; an element is present if, for every round
 * <code>i</code>, its slot holds at least <code>i</code>. A bit-array filter only asks
 * whether the slot was touched at all, so for the same sizing this filter answers
 * <code>true</code> less often for elements that were never added, at the cost of a byte
 * per slot instead of a bit.
 * <p>
 * Slot values are unsigned bytes, so sizings with more than 255 hash rounds are
 * rejected.
 */
public class OrdinalFilter<T> extends DoubleHashFilter<T> implements Cloneable {
  /**
   * Create a new filter to hold the given number of distinct values with a false positive
   * probability of about <code>fpp</code>.
   *
   * @param fpp    the false positive probability, strictly between 0 and 1
   * @param ndv    the number of distinct values, at least 1
   * @param hasher how elements are hashed
   * @throws IllegalArgumentException if <code>fpp</code> or <code>ndv</code> is out of
   *     range, the sizing needs more than 255 hash rounds, or the filter would be too
   *     large to allocate
   */
  public OrdinalFilter(double fpp, long ndv, ElementHasher<? super T> hasher) {
    this(Sizing.Compute(fpp, ndv)
        .CheckRounds(OrdinalSlots.MAX_ROUND)
        .CheckSlots(OrdinalSlots.MAX_SLOTS), hasher);
  }

  private OrdinalFilter(Sizing sizing, ElementHasher<? super T> hasher) {
    super(1, sizing, new OrdinalSlots(sizing.slotCount()), hasher);
  }

  private OrdinalFilter(ElementHasher<? super T> hasher) {
    super(1, new OrdinalSlots(0), hasher);
  }

  public static <T> OrdinalFilter<T> CreateWithNdvFpp(
      long ndv, double fpp, ElementHasher<? super T> hasher) {
    return new OrdinalFilter<T>(fpp, ndv, hasher);
  }

  /**
   * Calculates the expected false positive probability of a filter with
   * <code>slots</code> slots and <code>rounds</code> hash rounds once it holds
   * <code>ndv</code> distinct values.
   * <p>
   * A slot holds at least <code>i</code> unless none of the
   * <code>ndv * (rounds - i + 1)</code> probes from rounds <code>i</code> and up hit it,
   * so the probability is the product over <code>i</code> of
   * <code>1 - e^(-ndv * (rounds - i + 1) / slots)</code>.
   *
   * @param ndv    the number of distinct values
   * @param slots  the number of slots
   * @param rounds the number of hash rounds
   * @return the false positive probability
   */
  public static double Fpp(double ndv, long slots, int rounds) {
    if (ndv == 0) return 0.0;
    if (slots <= 0) return 1.0;
    double logResult = 0;
    for (int i = 1; i <= rounds; ++i) {
      logResult += Math.log(-Math.expm1(-ndv * (rounds - i + 1) / slots));
    }
    return Math.exp(logResult);
  }

  @Override
  public double expectedFpp() {
    if (isEmpty()) return 0.0;
    int k = hashRoundCount();
    long[] atLeast = new long[k + 1];
    ((OrdinalSlots) slots).AtLeast(atLeast);
    double m = slotCount();
    double result = 1.0;
    for (int i = 1; i <= k; ++i) {
      result *= atLeast[i] / m;
    }
    return result;
  }

  /**
   * Exchange the storage, sizing and hasher of this filter with those of
   * <code>that</code>.
   */
  public void Swap(OrdinalFilter<T> that) {
    Preconditions.checkNotNull(that, "that");
    SwapWith(that);
  }

  /**
   * Move this filter's storage to a new filter, leaving this one with no slots.
   *
   * @return the new owner of the storage
   * @see BitArrayFilter#Transfer()
   */
  public OrdinalFilter<T> Transfer() {
    OrdinalFilter<T> result = new OrdinalFilter<T>(hasher());
    result.TakeFrom(this, new OrdinalSlots(0));
    return result;
  }

  public void MoveFrom(OrdinalFilter<T> source) {
    Preconditions.checkNotNull(source, "source");
    TakeFrom(source, new OrdinalSlots(0));
  }

  @Override
  public OrdinalFilter<T> clone() {
    OrdinalFilter<T> result = new OrdinalFilter<T>(hasher());
    result.CopyFrom(this);
    return result;
  }
}
