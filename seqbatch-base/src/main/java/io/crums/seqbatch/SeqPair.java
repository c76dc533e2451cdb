/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


import java.util.Arrays;
import java.util.Objects;

/**
 * An id-less source / target sequence pair. This is what corpus preprocessing
 * produces and what the stores' write paths consume; ids are assigned by the
 * store.
 * 
 * @param x source sequence (copied)
 * @param y target sequence (copied), or {@code null} for monolingual data
 */
public record SeqPair(int[] x, int[] y) {
  
  public SeqPair {
    x = Objects.requireNonNull(x, "null x").clone();
    if (y != null)
      y = y.clone();
  }
  
  
  /** Creates a monolingual (source only) instance. */
  public SeqPair(int[] x) {
    this(x, null);
  }
  
  
  @Override
  public int[] x() {
    return x.clone();
  }
  
  @Override
  public int[] y() {
    return y == null ? null : y.clone();
  }
  
  
  public int xLen() {
    return x.length;
  }
  
  
  public int yLen() {
    return y == null ? SeqBatchConstants.NO_Y_LEN : y.length;
  }
  
  
  public boolean hasY() {
    return y != null;
  }
  
  
  /**
   * Returns a record with the given id and this instance's sequences.
   */
  public SeqRecord toRecord(long id) {
    return SeqRecord.wrap(id, x, y);
  }
  
  
  @Override
  public boolean equals(Object o) {
    return o instanceof SeqPair other &&
        Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
  }
  
  @Override
  public int hashCode() {
    return Arrays.hashCode(x) * 31 + Arrays.hashCode(y);
  }
  
  @Override
  public String toString() {
    return "SeqPair[x=" + Arrays.toString(x) +
        (y == null ? "" : ", y=" + Arrays.toString(y)) + "]";
  }

}
