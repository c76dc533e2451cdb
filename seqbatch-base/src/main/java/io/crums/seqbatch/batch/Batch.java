/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.batch;


/**
 * A padded, aligned group of records assembled for one training step.
 * Instances are created by a {@linkplain BatchBuilder}, used once by the
 * consumer, and discarded.
 * 
 * <h2>Layout</h2>
 * <p>
 * The sequence matrices are rectangular and filled with the pad value past each
 * row's live prefix. If {@linkplain #batchFirst()} they are {@code [size][maxLen]};
 * otherwise {@code [maxLen][size]}. The matrices are freshly allocated for
 * each batch and handed out as-is (no copy): the consumer owns them.
 * </p>
 * <p>
 * The target ({@code y}) side is only present if the records carry targets.
 * </p>
 */
public class Batch {
  
  private final long[] ids;
  
  private final int[][] xSeqs;
  private final int[] xLens;
  private final long xToks;
  private final int maxXLen;
  
  private final int[][] ySeqs;
  private final int[] yLens;
  private final long yToks;
  private final int maxYLen;
  
  private final boolean batchFirst;
  private final int padValue;
  private final int bosValue;
  private final int eosValue;
  
  
  Batch(
      long[] ids,
      int[][] xSeqs, int[] xLens, int maxXLen,
      int[][] ySeqs, int[] yLens, int maxYLen,
      Alignment alignment) {
    this.ids = ids;
    this.xSeqs = xSeqs;
    this.xLens = xLens;
    this.xToks = sum(xLens);
    this.maxXLen = maxXLen;
    this.ySeqs = ySeqs;
    this.yLens = yLens;
    this.yToks = yLens == null ? 0 : sum(yLens);
    this.maxYLen = maxYLen;
    this.batchFirst = alignment.batchFirst();
    this.padValue = alignment.padValue();
    this.bosValue = alignment.bosValue();
    this.eosValue = alignment.eosValue();
  }
  
  
  private static long sum(int[] lens) {
    long sum = 0;
    for (int len : lens)
      sum += len;
    return sum;
  }
  
  
  /** Returns the number of records (rows) in the batch. */
  public int size() {
    return ids.length;
  }
  
  
  /** Returns the record ids, in row order. */
  public long[] ids() {
    return ids.clone();
  }
  
  
  public boolean hasY() {
    return ySeqs != null;
  }
  
  
  public boolean batchFirst() {
    return batchFirst;
  }
  
  public int padValue() {
    return padValue;
  }
  
  public int bosValue() {
    return bosValue;
  }
  
  public int eosValue() {
    return eosValue;
  }
  
  
  /**
   * Returns the source matrix. Not a copy.
   */
  public int[][] xSeqs() {
    return xSeqs;
  }
  
  
  /** Returns the source lengths (after BOS/EOS insertion), in row order. */
  public int[] xLens() {
    return xLens.clone();
  }
  
  /** Total source tokens. */
  public long xToks() {
    return xToks;
  }
  
  public int maxXLen() {
    return maxXLen;
  }
  
  
  /**
   * Returns the target matrix. Not a copy.
   * 
   * @throws IllegalStateException if {@code !hasY()}
   */
  public int[][] ySeqs() {
    checkY();
    return ySeqs;
  }
  
  
  /**
   * @throws IllegalStateException if {@code !hasY()}
   */
  public int[] yLens() {
    checkY();
    return yLens.clone();
  }
  
  /** Total target tokens; zero if there's no target side. */
  public long yToks() {
    return yToks;
  }
  
  /** Zero if there's no target side. */
  public int maxYLen() {
    return maxYLen;
  }
  
  
  private void checkY() {
    if (ySeqs == null)
      throw new IllegalStateException("batch has no y side");
  }
  
  
  /**
   * Returns the source padding mask, batch-major regardless of orientation.
   * 
   * @see Masks#paddingMask(int[][], int)
   */
  public boolean[][] xPaddingMask() {
    return Masks.paddingMask(batchMajor(xSeqs), padValue);
  }
  
  
  /**
   * Returns the combined target padding and look-ahead mask,
   * {@code [size][maxYLen][maxYLen]}.
   * 
   * @see Masks#autoRegressiveMask(int[][], int)
   */
  public boolean[][][] yAutoRegressiveMask() {
    checkY();
    return Masks.autoRegressiveMask(batchMajor(ySeqs), padValue);
  }
  
  
  private int[][] batchMajor(int[][] matrix) {
    return batchFirst ? matrix : BatchBuilder.transpose(matrix);
  }
  
  
  @Override
  public String toString() {
    return "Batch[size=" + ids.length + ", maxXLen=" + maxXLen +
        (hasY() ? ", maxYLen=" + maxYLen : "") + "]";
  }

}
