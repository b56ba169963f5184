package com.github.obf.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.distribution.BinomialDistribution;
import org.junit.Test;

public class OrdinalFilterTest {
  public OrdinalFilterTest() {}

  private static final int OUTSIDERS = 100000;

  @Test
  public void StricterThanBitArray() {
    BitArrayFilter<Long> bits =
        BitArrayFilter.CreateWithNdvFpp(1000, 0.01, Murmur3ElementHasher.ForLongs());
    OrdinalFilter<Long> ordinals =
        OrdinalFilter.CreateWithNdvFpp(1000, 0.01, Murmur3ElementHasher.ForLongs());
    assertEquals(9586, ordinals.slotCount());
    assertEquals(7, ordinals.hashRoundCount());

    // (0, 1) probes slots 0..6 in the bit-array filter, and writes i to slot i for
    // i = 1..7 in the ordinal filter
    bits.AddHash128(0, 1);
    ordinals.AddHash128(0, 1);
    assertEquals(1, bits.slots.Read(0));
    assertEquals(1, bits.slots.Read(6));
    assertEquals(0, bits.slots.Read(7));
    assertEquals(7, ordinals.slots.Read(7));
    assertEquals(0, ordinals.slots.Read(0));

    // (6, -1) walks backwards: the bit-array filter probes 6..0, all set. The ordinal
    // filter probes 5, 4, 3, 2, ... at rounds 1, 2, 3, 4, ..., and slot 2 holds 2 < 4.
    assertTrue(bits.FindHash128(6, -1L));
    assertFalse(ordinals.FindHash128(6, -1L));

    assertTrue(bits.FindHash128(0, 1));
    assertTrue(ordinals.FindHash128(0, 1));
  }

  @Test
  public void KeepsLargestRound() {
    OrdinalFilter<Long> x =
        OrdinalFilter.CreateWithNdvFpp(1000, 0.01, Murmur3ElementHasher.ForLongs());
    // every round lands on slot 5
    assertTrue(x.AddHash128(5, 0));
    assertEquals(7, x.slots.Read(5));
    assertTrue(x.FindHash128(5, 0));
    // (4, 1) writes 1..7 to slots 5..11; slot 5 already holds 7 and must keep it
    x.AddHash128(4, 1);
    assertEquals(7, x.slots.Read(5));
    assertEquals(2, x.slots.Read(6));
    assertEquals(7, x.slots.Read(11));
    assertTrue(x.FindHash128(5, 0));
    assertTrue(x.FindHash128(4, 1));
    assertFalse(x.AddHash128(4, 1));
  }

  @Test
  public void FalsePositiveRate() {
    OrdinalFilter<String> ordinals =
        OrdinalFilter.CreateWithNdvFpp(1000, 0.01, Murmur3ElementHasher.ForStrings());
    BitArrayFilter<String> bits =
        BitArrayFilter.CreateWithNdvFpp(1000, 0.01, Murmur3ElementHasher.ForStrings());
    for (int i = 0; i < 1000; ++i) {
      ordinals.Add("member-" + i);
      bits.Add("member-" + i);
    }
    int ordinalHits = 0;
    int bitHits = 0;
    for (int j = 0; j < OUTSIDERS; ++j) {
      if (ordinals.Contains("outsider-" + j)) ++ordinalHits;
      if (bits.Contains("outsider-" + j)) ++bitHits;
    }

    double theory = OrdinalFilter.Fpp(1000, ordinals.slotCount(), ordinals.hashRoundCount());
    double measured = ordinals.expectedFpp();
    assertTrue(measured > theory / 2 && measured < theory * 2);

    double p = Math.max(theory, measured) * 2;
    int bound = new BinomialDistribution(OUTSIDERS, p).inverseCumulativeProbability(1 - 1e-9);
    assertTrue(ordinalHits + " > " + bound, ordinalHits <= bound);
    assertTrue(ordinalHits + " >= " + bitHits, ordinalHits < bitHits);
  }

  @Test
  public void TheoreticalFpp() {
    assertEquals(0.0, OrdinalFilter.Fpp(0, 9586, 7), 0.0);
    assertEquals(1.0, OrdinalFilter.Fpp(10, 0, 7), 0.0);
    double ordinal = OrdinalFilter.Fpp(1000, 9586, 7);
    assertTrue(ordinal > 1.0e-4 && ordinal < 2.5e-4);
    assertTrue(ordinal < BitArrayFilter.Fpp(1000, 9586, 7));
    // with one round the two variants are the same filter
    assertEquals(BitArrayFilter.Fpp(1000, 9586, 1), OrdinalFilter.Fpp(1000, 9586, 1), 1e-12);
  }

  @Test
  public void ExpectedFppOfEmpty() {
    OrdinalFilter<Long> x =
        OrdinalFilter.CreateWithNdvFpp(1000, 0.01, Murmur3ElementHasher.ForLongs());
    assertEquals(0.0, x.expectedFpp(), 0.0);
    x.AddHash128(5, 0);
    // only slot 5 is set, to 7: every round is covered by it alone
    assertEquals(Math.pow(1.0 / 9586, 7), x.expectedFpp(), 1e-40);
  }
}
