/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


import java.util.Arrays;
import java.util.Objects;

/**
 * One training example: a source (x) integer sequence and an optional
 * target (y) sequence, tagged with an id unique within its store.
 * 
 * <h2>Immutability</h2>
 * <p>
 * Instances are immutable. The sequences are copied on the way in and never
 * handed out directly: use {@linkplain #x()} / {@linkplain #y()} for copies, or
 * the positional accessors and {@linkplain #copyX(int[], int)} /
 * {@linkplain #copyY(int[], int)} to read without allocating. Stores may
 * therefore cache and hand out the same instance across passes.
 * </p>
 */
public final class SeqRecord {
  
  private final long id;
  private final int[] x;
  private final int[] y;
  
  
  /**
   * Creates a record without a target sequence.
   */
  public SeqRecord(long id, int[] x) {
    this(id, x, null);
  }

  /**
   * @param id  record id
   * @param x   source sequence (copied)
   * @param y   target sequence (copied), or {@code null} if none
   */
  public SeqRecord(long id, int[] x, int[] y) {
    this(id, Objects.requireNonNull(x, "null x").clone(), y == null ? null : y.clone(), false);
  }
  
  
  // no-copy constructor: callers promise they don't keep references
  private SeqRecord(long id, int[] x, int[] y, boolean trusted) {
    this.id = id;
    this.x = x;
    this.y = y;
  }
  
  
  /**
   * Creates an instance wrapping the given arrays without copying them. The
   * caller must not retain references to the arrays.
   */
  static SeqRecord wrap(long id, int[] x, int[] y) {
    return new SeqRecord(id, Objects.requireNonNull(x, "null x"), y, true);
  }
  
  
  public long id() {
    return id;
  }
  
  /** Returns the {@code x_len} column value. */
  public int xLen() {
    return x.length;
  }
  
  /**
   * Returns the {@code y_len} column value, or {@linkplain SeqBatchConstants#NO_Y_LEN -1}
   * if there's no target sequence.
   */
  public int yLen() {
    return y == null ? SeqBatchConstants.NO_Y_LEN : y.length;
  }
  
  
  public boolean hasY() {
    return y != null;
  }
  
  
  /**
   * Returns the greater of the source and target lengths. This is the length
   * that counts against a batch's token budget.
   */
  public int maxLen() {
    return Math.max(x.length, yLen());
  }
  
  
  /**
   * Determines whether either side is empty. (A missing target doesn't count
   * as empty.)
   */
  public boolean hasEmptySide() {
    return x.length == 0 || (y != null && y.length == 0);
  }
  
  
  /** Returns a copy of the source sequence. */
  public int[] x() {
    return x.clone();
  }
  
  /** Returns a copy of the target sequence, or {@code null}. */
  public int[] y() {
    return y == null ? null : y.clone();
  }
  
  
  public int x(int index) {
    return x[index];
  }
  
  
  public int y(int index) {
    if (y == null)
      throw new IllegalStateException("no y sequence in record " + id);
    return y[index];
  }
  
  
  /**
   * Copies the source sequence into the given array.
   * 
   * @return the number of elements copied ({@linkplain #xLen()})
   */
  public int copyX(int[] dest, int offset) {
    System.arraycopy(x, 0, dest, offset, x.length);
    return x.length;
  }
  
  
  /**
   * Copies the target sequence into the given array.
   * 
   * @return the number of elements copied ({@linkplain #yLen()})
   */
  public int copyY(int[] dest, int offset) {
    if (y == null)
      throw new IllegalStateException("no y sequence in record " + id);
    System.arraycopy(y, 0, dest, offset, y.length);
    return y.length;
  }
  
  
  /**
   * Returns a record with the same id and sequences cut to the given
   * maximum lengths. Returns this instance if no cutting is needed.
   */
  public SeqRecord truncate(int maxXLen, int maxYLen) {
    boolean cutX = x.length > maxXLen;
    boolean cutY = y != null && y.length > maxYLen;
    if (!cutX && !cutY)
      return this;
    return wrap(
        id,
        cutX ? Arrays.copyOf(x, maxXLen) : x,
        cutY ? Arrays.copyOf(y, maxYLen) : y);
  }
  
  
  /**
   * Determines whether either sequence exceeds its given maximum length.
   */
  public boolean exceeds(int maxXLen, int maxYLen) {
    return x.length > maxXLen || (y != null && y.length > maxYLen);
  }
  
  
  /**
   * Returns the id-less pair view of this record.
   */
  public SeqPair toPair() {
    return new SeqPair(x, y);
  }
  

  /**
   * Instances are equal if they have the same id and sequences.
   */
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof SeqRecord other))
      return false;
    return id == other.id && Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id) * 31 + Arrays.hashCode(x);
  }

  @Override
  public String toString() {
    return "SeqRecord[id=" + id + ", x=" + Arrays.toString(x) +
        (y == null ? "" : ", y=" + Arrays.toString(y)) + "]";
  }

}
