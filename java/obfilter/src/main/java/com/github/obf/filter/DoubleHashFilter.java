package com.github.obf.filter;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DoubleHashFilter is the part of a Bloom filter that does not depend on what a slot
 * stores: sizing, probing and ownership of the slot array.
 * <p>
 * Each element is hashed once to 128 bits. The two 64-bit halves <code>(lo, hi)</code>
 * then give one probe per round <code>i</code> at <code>(lo + i * hi) mod slotCount</code>
 * (see Kirsch and Mitzenmacher's "Less Hashing, Same Performance: Building a Better Bloom
 * Filter"). Rounds run from <code>firstRound</code> through
 * <code>firstRound + hashRoundCount - 1</code>.
 * <p>
 * Filters are single-owner and unsynchronized. Storage is never shared between two live
 * filters: <code>clone()</code> deep-copies it, and a transfer leaves the source with no
 * storage at all.
 */
public abstract class DoubleHashFilter<T> implements Filter<T> {
  private static final Logger LOG = LoggerFactory.getLogger(DoubleHashFilter.class);

  private final int firstRound;
  Slots slots;
  private long slotCount;
  private int hashRoundCount;
  private ElementHasher<? super T> hasher;

  DoubleHashFilter(int firstRound, Sizing sizing, Slots slots, ElementHasher<? super T> hasher) {
    this.firstRound = firstRound;
    this.slots = slots;
    this.slotCount = sizing.slotCount();
    this.hashRoundCount = sizing.hashRoundCount();
    this.hasher = Preconditions.checkNotNull(hasher, "hasher");
    LOG.debug("Created {} with {} slots, {} hash rounds, {} bytes",
        getClass().getSimpleName(), slotCount, hashRoundCount, slots.sizeInBytes());
  }

  // A filter with no storage, the state a transfer leaves behind.
  DoubleHashFilter(int firstRound, Slots empty, ElementHasher<? super T> hasher) {
    this.firstRound = firstRound;
    this.slots = empty;
    this.slotCount = 0;
    this.hashRoundCount = 0;
    this.hasher = hasher;
  }

  public long slotCount() { return slotCount; }

  public int hashRoundCount() { return hashRoundCount; }

  public long sizeInBytes() { return slots.sizeInBytes(); }

  /** True if this filter's storage has been transferred to another filter. */
  public boolean isEmpty() { return slotCount == 0; }

  /**
   * Calculates the false positive probability of this filter from how full it actually
   * is, rather than from the number of distinct values it was sized for.
   */
  public abstract double expectedFpp();

  @Override
  public boolean Add(T element) {
    HashCode hash = hasher.Hash128(element);
    return AddHash128(Hashes.Low(hash), Hashes.High(hash));
  }

  @Override
  public boolean AddHash128(long lo, long hi) {
    if (slotCount == 0) {
      throw new IllegalStateException("filter storage has been transferred away");
    }
    boolean changed = false;
    for (int i = firstRound; i < firstRound + hashRoundCount; ++i) {
      changed |= slots.Write(Probe.Index(lo, hi, i, slotCount), i);
    }
    return changed;
  }

  @Override
  public boolean Contains(T element) {
    HashCode hash = hasher.Hash128(element);
    return FindHash128(Hashes.Low(hash), Hashes.High(hash));
  }

  @Override
  public boolean FindHash128(long lo, long hi) {
    if (slotCount == 0) return false;
    for (int i = firstRound; i < firstRound + hashRoundCount; ++i) {
      if (!slots.Covers(Probe.Index(lo, hi, i, slotCount), i)) return false;
    }
    return true;
  }

  @Override
  public void Clear() {
    slots.Clear();
  }

  // Exchanges everything but the round numbering, which is fixed by the variant.
  void SwapWith(DoubleHashFilter<T> that) {
    Slots s = slots;
    slots = that.slots;
    that.slots = s;

    long m = slotCount;
    slotCount = that.slotCount;
    that.slotCount = m;

    int k = hashRoundCount;
    hashRoundCount = that.hashRoundCount;
    that.hashRoundCount = k;

    ElementHasher<? super T> h = hasher;
    hasher = that.hasher;
    that.hasher = h;
  }

  // Moves the storage of source into this filter, leaving source with none.
  void TakeFrom(DoubleHashFilter<T> source, Slots empty) {
    if (source == this) return;
    LOG.debug("Transferring {} slots from one {} to another", source.slotCount,
        getClass().getSimpleName());
    slots = source.slots;
    slotCount = source.slotCount;
    hashRoundCount = source.hashRoundCount;
    hasher = source.hasher;
    source.slots = empty;
    source.slotCount = 0;
    source.hashRoundCount = 0;
  }

  ElementHasher<? super T> hasher() { return hasher; }

  // copies the sizing and the slots, not just the reference to them
  void CopyFrom(DoubleHashFilter<T> source) {
    slots = source.slots.clone();
    slotCount = source.slotCount;
    hashRoundCount = source.hashRoundCount;
    hasher = source.hasher;
  }

  /**
   * Two filters are equal if they have the same variant, sizing, slot contents and
   * hasher. Equal storage under different hashers answers differently, so it is not
   * enough.
   */
  @Override
  public boolean equals(Object there) {
    if (there == null) return false;
    if (there.getClass() != getClass()) return false;
    DoubleHashFilter<?> that = (DoubleHashFilter<?>) there;
    return slotCount == that.slotCount && hashRoundCount == that.hashRoundCount
        && hasher.equals(that.hasher) && slots.equals(that.slots);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Long.hashCode(slotCount) + hashRoundCount) + slots.hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{slots=" + slotCount + ", rounds=" + hashRoundCount
        + ", bytes=" + sizeInBytes() + "}";
  }
}
