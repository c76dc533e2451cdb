/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.iter;


import io.crums.seqbatch.BatchOverflowException;

/**
 * Token-budget admission rule. Tracks the running {@code (count, maxLen)} of
 * the current bucket; a candidate of length {@code len} is admitted iff
 * {@code (count + 1) * max(maxLen, len) <= budget}. So for every bucket,
 * {@code count * maxLen <= budget}.
 * <p>
 * Not thread-safe.
 * </p>
 */
class TokenBucketer {
  
  private final int budget;
  
  private int count;
  private int maxLen;
  
  
  TokenBucketer(int budget) {
    if (budget < 1)
      throw new IllegalArgumentException("token budget " + budget);
    this.budget = budget;
  }
  
  
  int budget() {
    return budget;
  }
  
  
  /**
   * Offers the next record's lengths.
   * 
   * @return {@code true} if the record was admitted into the current bucket;
   *         {@code false}, if the current bucket is full, in which case the
   *         caller must close (flush) it: the record then starts the next bucket
   * 
   * @throws BatchOverflowException if the record alone exceeds the budget
   */
  boolean offer(long id, int xLen, int yLen) throws BatchOverflowException {
    final int len = Math.max(xLen, yLen);
    if ((count + 1L) * Math.max(maxLen, len) <= budget) {
      ++count;
      maxLen = Math.max(maxLen, len);
      return true;
    }
    if (len > budget)
      throw new BatchOverflowException(
          "unable to make a batch of " + budget + " toks with a seq of x_len:" + xLen +
          " y_len:" + yLen + " (record " + id + ")");
    count = 1;
    maxLen = len;
    return false;
  }
  
  
  /** Returns the number of records in the current bucket. */
  int count() {
    return count;
  }
  
  
  int maxLen() {
    return maxLen;
  }

}
