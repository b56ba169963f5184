package com.github.obf.filter;

/**
 * StaticFilter represents approximate membership query objects.
 */
public interface StaticFilter<T> {
  /**
   * Find an element in the filter.
   * <p>
   * Never returns <code>false</code> for an element that was passed to <code>Add</code>;
   * may return <code>true</code> for an element that never was.
   *
   * @param element the element you are checking the presence of
   */
  boolean Contains(T element);

  /**
   * Find a 128-bit hash value in the filter.
   * <p>
   * Do not pass values to this function, only their hashes. <code>lo</code> and
   * <code>hi</code> are the two 64-bit words of a 128-bit hash, in the order
   * MurmurHash3_x64_128 produces them. <code>Contains(x)</code> is
   * <code>FindHash128</code> applied to the hash of <code>x</code>.
   *
   * @param lo the low 64 bits of the hash
   * @param hi the high 64 bits of the hash
   */
  boolean FindHash128(long lo, long hi);
}
