package com.github.obf.filter;

import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Murmur3ElementHasher hashes elements with 128-bit x64 MurmurHash3, seed 0.
 * <p>
 * The bytes fed to the hash are whatever the {@link Funnel} writes. Primitive funnels
 * write little-endian, so <code>ForLongs()</code> hashes the same eight bytes a 64-bit
 * integer occupies in memory on x86.
 */
public final class Murmur3ElementHasher<T> implements ElementHasher<T> {
  private static final HashFunction MURMUR3_128 = Hashing.murmur3_128(0);

  private final Funnel<? super T> funnel;

  private Murmur3ElementHasher(Funnel<? super T> funnel) {
    this.funnel = Preconditions.checkNotNull(funnel, "funnel");
  }

  public static <T> Murmur3ElementHasher<T> Of(Funnel<? super T> funnel) {
    return new Murmur3ElementHasher<T>(funnel);
  }

  public static Murmur3ElementHasher<Long> ForLongs() {
    return new Murmur3ElementHasher<Long>(Funnels.longFunnel());
  }

  public static Murmur3ElementHasher<Integer> ForInts() {
    return new Murmur3ElementHasher<Integer>(Funnels.integerFunnel());
  }

  public static Murmur3ElementHasher<CharSequence> ForStrings() {
    return new Murmur3ElementHasher<CharSequence>(Funnels.stringFunnel(StandardCharsets.UTF_8));
  }

  public static Murmur3ElementHasher<byte[]> ForBytes() {
    return new Murmur3ElementHasher<byte[]>(Funnels.byteArrayFunnel());
  }

  @Override
  public HashCode Hash128(T element) {
    return MURMUR3_128.hashObject(element, funnel);
  }

  // Guava's built-in funnels compare equal when they write the same bytes.
  @Override
  public boolean equals(Object there) {
    if (there == null) return false;
    if (!(there instanceof Murmur3ElementHasher)) return false;
    Murmur3ElementHasher<?> that = (Murmur3ElementHasher<?>) there;
    return funnel.equals(that.funnel);
  }

  @Override
  public int hashCode() {
    return funnel.hashCode();
  }
}
