/*
 * Copyright (c) 2014, Oracle America, Inc.
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 *  * Redistributions of source code must retain the above copyright notice,
 *    this list of conditions and the following disclaimer.
 *
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 *
 *  * Neither the name of Oracle nor the names of its contributors may be used
 *    to endorse or promote products derived from this software without
 *    specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF
 * THE POSSIBILITY OF SUCH DAMAGE.
 */

package com.github.obf.filter;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.*;
import org.openjdk.jmh.runner.options.*;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.SampleTime)
@Warmup(iterations = 1, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class FilterBenchmark {
  @State(Scope.Thread)
  public static class MyState {
    @Param({"2", "3", "4", "5", "6"})
    int exponent;
    @Param({"0.01", "0.001"})
    double fpp;
    long ndv;
    BitArrayFilter<Long> b;
    OrdinalFilter<Long> o;

    @Setup(Level.Trial)
    public void Fill() {
      ndv = (long) Math.pow(10, exponent);
      b = new BitArrayFilterFactory<Long>(Murmur3ElementHasher.ForLongs())
          .CreateWithNdvFpp(ndv, fpp);
      o = new OrdinalFilterFactory<Long>(Murmur3ElementHasher.ForLongs())
          .CreateWithNdvFpp(ndv, fpp);
      for (long i = 0; i < ndv; ++i) {
        b.Add(i);
        o.Add(i);
      }
    }
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 1, time = 10, timeUnit = TimeUnit.SECONDS)
  public BitArrayFilter<Long> BenchBitArrayAdd(MyState s) {
    BitArrayFilter<Long> b = s.b.clone();
    b.Clear();
    for (long i = 0; i < s.ndv; ++i) {
      b.Add(i);
    }
    return b;
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 1, time = 10, timeUnit = TimeUnit.SECONDS)
  public OrdinalFilter<Long> BenchOrdinalAdd(MyState s) {
    OrdinalFilter<Long> o = s.o.clone();
    o.Clear();
    for (long i = 0; i < s.ndv; ++i) {
      o.Add(i);
    }
    return o;
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 1, time = 10, timeUnit = TimeUnit.SECONDS)
  public void BenchBitArrayContains(MyState s, Blackhole bh) {
    // half members, half not
    for (long i = s.ndv / 2; i < s.ndv + s.ndv / 2; ++i) {
      bh.consume(s.b.Contains(i));
    }
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 1, time = 10, timeUnit = TimeUnit.SECONDS)
  public void BenchOrdinalContains(MyState s, Blackhole bh) {
    for (long i = s.ndv / 2; i < s.ndv + s.ndv / 2; ++i) {
      bh.consume(s.o.Contains(i));
    }
  }

  public static void main(String[] args) throws RunnerException {
    Options opt = new OptionsBuilder()
        .include(FilterBenchmark.class.getSimpleName())
        .build();
    new Runner(opt).run();
  }
}
