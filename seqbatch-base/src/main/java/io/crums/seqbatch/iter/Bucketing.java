/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.iter;


import java.util.Locale;

/**
 * Bucketing strategies: the policy deciding which records are grouped into
 * the same batch.
 * 
 * @see BatchIterable
 */
public enum Bucketing {
  
  /**
   * Records are taken in store order and packed greedily under the
   * token budget.
   */
  SEQUENTIAL,
  
  /**
   * Buckets are formed from a (jittered) target-length-descending projection,
   * so each batch is nearly length-homogeneous. The order of the buckets is
   * shuffled every pass. Requires an indexed store.
   */
  EQ_LEN_RANDOM;
  
  
  public String symbol() {
    return name().toLowerCase(Locale.ROOT);
  }
  
  
  /**
   * Parses the given symbol (case insensitive). {@code "eq_len_rand_batch"} is
   * accepted as an alias for {@linkplain #EQ_LEN_RANDOM}.
   */
  public static Bucketing forSymbol(String symbol) {
    String s = symbol.trim().toLowerCase(Locale.ROOT);
    switch (s) {
    case "sequential":
      return SEQUENTIAL;
    case "eq_len_random":
    case "eq_len_rand_batch":
      return EQ_LEN_RANDOM;
    default:
      throw new IllegalArgumentException("unknown bucketing strategy: '" + symbol + "'");
    }
  }

}
