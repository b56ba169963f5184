package com.github.obf.filter;

import com.google.common.base.Preconditions;

/**
 * BitArrayFilter is a classic Bloom filter (Bloom's "Space/Time Trade-offs in Hash Coding
 * with Allowable Errors"): one bit per slot, <code>hashRoundCount</code> bits set per
 * element, and an element is present if all of its bits are set.
 * <p>
 * Rounds are numbered from zero, so round 0 probes <code>lo mod slotCount</code>.
 */
public class BitArrayFilter<T> extends DoubleHashFilter<T> implements Cloneable {
  /**
   * Create a new filter to hold the given number of distinct values with a false positive
   * probability of about <code>fpp</code>.
   *
   * @param fpp    the false positive probability, strictly between 0 and 1
   * @param ndv    the number of distinct values, at least 1
   * @param hasher how elements are hashed
   * @throws IllegalArgumentException if <code>fpp</code> or <code>ndv</code> is out of
   *     range, or the filter would be too large to allocate
   */
  public BitArrayFilter(double fpp, long ndv, ElementHasher<? super T> hasher) {
    this(Sizing.Compute(fpp, ndv).CheckSlots(BitSlots.MAX_SLOTS), hasher);
  }

  private BitArrayFilter(Sizing sizing, ElementHasher<? super T> hasher) {
    super(0, sizing, new BitSlots(sizing.slotCount()), hasher);
  }

  private BitArrayFilter(ElementHasher<? super T> hasher) {
    super(0, new BitSlots(0), hasher);
  }

  /**
   * Create a new filter to hold the given number of distinct values with a false positive
   * probability of about <code>fpp</code>.
   *
   * @param ndv    the number of distinct values
   * @param fpp    the false positive probability
   * @param hasher how elements are hashed
   */
  public static <T> BitArrayFilter<T> CreateWithNdvFpp(
      long ndv, double fpp, ElementHasher<? super T> hasher) {
    return new BitArrayFilter<T>(fpp, ndv, hasher);
  }

  /**
   * Calculates the expected false positive probability of a filter with
   * <code>slots</code> bits and <code>rounds</code> hash rounds once it holds
   * <code>ndv</code> distinct values: <code>(1 - e^(-rounds * ndv / slots))^rounds</code>.
   *
   * @param ndv    the number of distinct values
   * @param slots  the number of bits
   * @param rounds the number of hash rounds
   * @return the false positive probability
   */
  public static double Fpp(double ndv, long slots, int rounds) {
    if (ndv == 0) return 0.0;
    if (slots <= 0) return 1.0;
    return Math.pow(-Math.expm1(-rounds * ndv / slots), rounds);
  }

  @Override
  public double expectedFpp() {
    if (isEmpty()) return 0.0;
    double fill = (double) ((BitSlots) slots).Count() / slotCount();
    return Math.pow(fill, hashRoundCount());
  }

  /**
   * Estimates the number of distinct values added so far from the fraction of bits set
   * (Swamidass and Baldi): <code>-(slots / rounds) ln(1 - fill)</code>.
   *
   * @return the estimate, or <code>Long.MAX_VALUE</code> once every bit is set
   */
  public long ApproximateCardinality() {
    if (isEmpty() || hashRoundCount() == 0) return 0;
    long set = ((BitSlots) slots).Count();
    if (set == slotCount()) return Long.MAX_VALUE;
    double m = slotCount();
    return Math.round(-(m / hashRoundCount()) * Math.log1p(-set / m));
  }

  /**
   * Exchange the storage, sizing and hasher of this filter with those of
   * <code>that</code>.
   */
  public void Swap(BitArrayFilter<T> that) {
    Preconditions.checkNotNull(that, "that");
    SwapWith(that);
  }

  /**
   * Move this filter's storage to a new filter.
   * <p>
   * Afterwards this filter has no slots: <code>Contains</code> returns false for every
   * element, and <code>Add</code> throws until storage is swapped or moved back in.
   *
   * @return the new owner of the storage
   */
  public BitArrayFilter<T> Transfer() {
    BitArrayFilter<T> result = new BitArrayFilter<T>(hasher());
    result.TakeFrom(this, new BitSlots(0));
    return result;
  }

  /**
   * Replace this filter's storage with the storage of <code>source</code>, leaving
   * <code>source</code> with none. Moving a filter into itself does nothing.
   */
  public void MoveFrom(BitArrayFilter<T> source) {
    Preconditions.checkNotNull(source, "source");
    TakeFrom(source, new BitSlots(0));
  }

  @Override
  public BitArrayFilter<T> clone() {
    BitArrayFilter<T> result = new BitArrayFilter<T>(hasher());
    result.CopyFrom(this);
    return result;
  }
}
