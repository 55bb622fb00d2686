package com.polydoc.filter;

/**
 * Channel receiving whole-filter failures absorbed by {@link SafeFilter}. Reports never reach the
 * document itself.
 */
public interface FilterDiagnostics {

  void report(String filterName, Throwable error);
}
