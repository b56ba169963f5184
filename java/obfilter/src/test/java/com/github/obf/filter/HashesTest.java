package com.github.obf.filter;

import static org.junit.Assert.assertEquals;

import com.google.common.hash.HashCode;

import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

public class HashesTest {
  public HashesTest() {}

  static HashCode Of(long lo, long hi) {
    return HashCode.fromBytes(
        ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN).putLong(lo).putLong(hi).array());
  }

  @Test
  public void SplitsHalves() {
    HashCode h = Of(0x0102030405060708L, 0xf0e0d0c0b0a09080L);
    assertEquals(0x0102030405060708L, Hashes.Low(h));
    assertEquals(0xf0e0d0c0b0a09080L, Hashes.High(h));
  }

  @Test(expected = IllegalArgumentException.class)
  public void RejectsShortHashes() {
    Hashes.High(HashCode.fromLong(5));
  }

  @Test
  public void ProbeWrapsUnsigned() {
    assertEquals(5, Probe.Index(-1L, 0, 0, 10));
    // 2^64 - 1 + 1 wraps to zero
    assertEquals(0, Probe.Index(-1L, 1, 1, 10));
    assertEquals(3, Probe.Index(0, 1, 3, 10));
    assertEquals(7, Probe.Index(1, 2, 3, 10));
    // 6 + 4 * (2^64 - 1) is 2 mod 2^64
    assertEquals(2, Probe.Index(6, -1L, 4, 9586));
    assertEquals(0, Probe.Index(123456789L, 987654321L, 17, 1));
  }
}
