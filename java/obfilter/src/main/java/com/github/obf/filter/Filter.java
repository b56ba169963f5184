package com.github.obf.filter;

/**
 * Filter represents approximate membership query objects that can be added to.
 */
public interface Filter<T> extends StaticFilter<T> {
  /**
   * Add an element to the filter.
   * <p>
   * Adding the same element again has no effect on later <code>Contains</code> results.
   *
   * @param element the element you wish to insert
   * @return true if any slot of the filter changed
   */
  boolean Add(T element);

  /**
   * Add a 128-bit hash value to the filter.
   * <p>
   * Do not mix hashes from different hash functions in one filter: a value added with
   * one will not be found when looking up the hash of the same element with the other.
   *
   * @param lo the low 64 bits of the hash
   * @param hi the high 64 bits of the hash
   * @return true if any slot of the filter changed
   */
  boolean AddHash128(long lo, long hi);

  /**
   * Reset the filter to the state it had right after construction.
   */
  void Clear();
}
