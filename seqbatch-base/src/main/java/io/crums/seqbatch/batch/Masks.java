/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.batch;


/**
 * Pure mask functions over already built, <em>batch-major</em>
 * ({@code [batch][seq]}) matrices. {@code true} means "attend" (keep);
 * {@code false} means masked out.
 */
public class Masks {
  
  private Masks() {  }
  
  
  /**
   * Returns the padding mask: {@code mask[b][j] = seqs[b][j] != padValue}.
   */
  public static boolean[][] paddingMask(int[][] seqs, int padValue) {
    boolean[][] mask = new boolean[seqs.length][];
    for (int b = 0; b < seqs.length; ++b) {
      int[] row = seqs[b];
      mask[b] = new boolean[row.length];
      for (int j = 0; j < row.length; ++j)
        mask[b][j] = row[j] != padValue;
    }
    return mask;
  }
  
  
  /**
   * Returns the {@code [size][size]} look-ahead mask: position {@code i} may
   * only see positions {@code j <= i}. (The upper triangle above the diagonal
   * is masked out.)
   */
  public static boolean[][] subsequentMask(int size) {
    if (size < 0)
      throw new IllegalArgumentException("size " + size);
    boolean[][] mask = new boolean[size][size];
    for (int i = 0; i < size; ++i)
      for (int j = 0; j <= i; ++j)
        mask[i][j] = true;
    return mask;
  }
  
  
  /**
   * Returns the combined padding and look-ahead mask for autoregressive
   * decoding: {@code mask[b][i][j] = seqs[b][j] != padValue && j <= i}.
   * 
   * @param seqs      batch-major target matrix (rectangular)
   * @param padValue  pad value
   * 
   * @return {@code [batch][seq][seq]} mask
   */
  public static boolean[][][] autoRegressiveMask(int[][] seqs, int padValue) {
    boolean[][][] mask = new boolean[seqs.length][][];
    for (int b = 0; b < seqs.length; ++b) {
      int[] row = seqs[b];
      final int len = row.length;
      mask[b] = new boolean[len][len];
      for (int i = 0; i < len; ++i)
        for (int j = 0; j <= i; ++j)
          mask[b][i][j] = row[j] != padValue;
    }
    return mask;
  }
  
  
  /**
   * Returns a length mask: {@code mask[b][j] = j < lengths[b]}.
   * 
   * @param lengths   sequence lengths
   * @param maxLen    mask width; if &lt; 0, the maximum of {@code lengths} is used
   */
  public static boolean[][] lengthMask(int[] lengths, int maxLen) {
    if (maxLen < 0) {
      maxLen = 0;
      for (int len : lengths)
        maxLen = Math.max(maxLen, len);
    }
    boolean[][] mask = new boolean[lengths.length][maxLen];
    for (int b = 0; b < lengths.length; ++b) {
      int live = Math.min(lengths[b], maxLen);
      for (int j = 0; j < live; ++j)
        mask[b][j] = true;
    }
    return mask;
  }

}
