/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import java.util.Locale;

/**
 * Named read (sort) policies for stores that can order their records.
 * The length-based policies apply a jitter window {@code J}: the sort key
 * is {@code length + (random mod J)}, so records come out <em>mostly</em>
 * length-sorted while which same-length records end up adjacent varies from
 * pass to pass. With {@code J = 1} the sort is exact.
 * 
 * @see LengthOrdering
 */
public enum ReadOrder {
  
  /** Uniformly shuffled. */
  RANDOM,
  X_LEN_ASC,
  X_LEN_DESC,
  Y_LEN_ASC,
  Y_LEN_DESC,
  /**
   * Target length descending, with jitter. Used to form equal-length
   * randomized batches.
   */
  EQ_LEN_RAND_BATCH;
  
  
  /**
   * Returns {@code true} if this policy sorts by the target ({@code y_len}) column
   * (or by the source length, for records with no target).
   */
  public boolean byTarget() {
    return this == Y_LEN_ASC || this == Y_LEN_DESC || this == EQ_LEN_RAND_BATCH;
  }
  
  
  public boolean descending() {
    return this == X_LEN_DESC || this == Y_LEN_DESC || this == EQ_LEN_RAND_BATCH;
  }
  
  
  /**
   * Returns the lower case name, e.g. {@code "y_len_desc"}.
   */
  public String symbol() {
    return name().toLowerCase(Locale.ROOT);
  }
  
  
  /**
   * Parses the given {@linkplain #symbol() symbol} (case insensitive).
   * 
   * @throws IllegalArgumentException if not a known policy
   */
  public static ReadOrder forSymbol(String symbol) {
    String name = symbol.trim().toUpperCase(Locale.ROOT);
    for (var order : values())
      if (order.name().equals(name))
        return order;
    throw new IllegalArgumentException("unknown read order: '" + symbol + "'");
  }

}
