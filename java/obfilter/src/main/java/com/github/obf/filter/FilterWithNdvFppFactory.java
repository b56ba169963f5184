package com.github.obf.filter;

public interface FilterWithNdvFppFactory<T, F extends Filter<T>> {
  F CreateWithNdvFpp(long ndv, double fpp);
}
