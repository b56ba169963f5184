package com.github.obf.filter;

public class BitArrayFilterFactory<T> implements FilterWithNdvFppFactory<T, BitArrayFilter<T>> {
  private final ElementHasher<? super T> hasher;

  public BitArrayFilterFactory(ElementHasher<? super T> hasher) {
    this.hasher = hasher;
  }

  @Override
  public BitArrayFilter<T> CreateWithNdvFpp(long ndv, double fpp) {
    return BitArrayFilter.CreateWithNdvFpp(ndv, fpp, hasher);
  }
}
