package com.github.obf.filter;

import com.google.common.hash.HashCode;

/**
 * ElementHasher turns an element into the 128-bit hash a filter derives its probe
 * positions from.
 * <p>
 * Implementations must be deterministic: the same logical element must always produce
 * the same hash, or elements that were added will not be found.
 */
public interface ElementHasher<T> {
  /**
   * @param element the element to hash
   * @return a hash of exactly 128 bits; see {@link Hashes#Low} and {@link Hashes#High}
   */
  HashCode Hash128(T element);
}
