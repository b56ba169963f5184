package com.github.obf.filter;

public class OrdinalFilterFactory<T> implements FilterWithNdvFppFactory<T, OrdinalFilter<T>> {
  private final ElementHasher<? super T> hasher;

  public OrdinalFilterFactory(ElementHasher<? super T> hasher) {
    this.hasher = hasher;
  }

  @Override
  public OrdinalFilter<T> CreateWithNdvFpp(long ndv, double fpp) {
    return OrdinalFilter.CreateWithNdvFpp(ndv, fpp, hasher);
  }
}
