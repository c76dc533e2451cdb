/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.prep;


import java.util.Arrays;

import io.crums.seqbatch.SeqBatchConstants;

/**
 * Maximum sequence lengths, and what to do with longer sequences.
 * 
 * @param maxSrcLen maximum source length (&ge; 1)
 * @param maxTgtLen maximum target length (&ge; 1)
 * @param truncate  if {@code true}, longer sequences are cut; otherwise, a pair
 *                  with either side too long is dropped
 */
public record LengthPolicy(int maxSrcLen, int maxTgtLen, boolean truncate) {
  
  /** 512 / 512, filtering (no truncation). */
  public final static LengthPolicy DEFAULT =
      new LengthPolicy(SeqBatchConstants.DEF_MAX_SRC_LEN, SeqBatchConstants.DEF_MAX_TGT_LEN, false);
  
  public LengthPolicy {
    if (maxSrcLen < 1 || maxTgtLen < 1)
      throw new IllegalArgumentException(
          "maxSrcLen " + maxSrcLen + ", maxTgtLen " + maxTgtLen);
  }
  
  
  /**
   * Applies the policy to a pair of sequences.
   * 
   * @return the (possibly truncated) pair, or {@code null} if filtered out
   */
  int[][] apply(int[] src, int[] tgt) {
    if (truncate)
      return new int[][] { cut(src, maxSrcLen), cut(tgt, maxTgtLen) };
    if (src.length > maxSrcLen || tgt.length > maxTgtLen)
      return null;
    return new int[][] { src, tgt };
  }
  
  
  /**
   * Applies the source side of the policy to a monolingual sequence.
   * 
   * @return the (possibly truncated) sequence, or {@code null} if filtered out
   */
  int[] applyMono(int[] seq) {
    if (truncate)
      return cut(seq, maxSrcLen);
    return seq.length > maxSrcLen ? null : seq;
  }
  
  
  private static int[] cut(int[] seq, int max) {
    return seq.length > max ? Arrays.copyOf(seq, max) : seq;
  }

}
