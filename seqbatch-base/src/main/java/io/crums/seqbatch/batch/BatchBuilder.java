/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.batch;


import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import io.crums.seqbatch.InvalidAlignmentException;
import io.crums.seqbatch.SeqRecord;

/**
 * Builds {@linkplain Batch}es from lists of records under an {@linkplain Alignment}.
 * 
 * <h2>BOS/EOS Enforcement</h2>
 * <p>
 * For each side with BOS on, the BOS value is prepended unless the sequence
 * already starts with it; with BOS off, a sequence starting with the BOS value
 * is an error. Same for EOS at the end of the sequence. So enforcement is
 * idempotent. The augmented sequences are new arrays: the records themselves
 * are never modified, and may be reused across batches and passes.
 * </p>
 * <h2>Target Presence</h2>
 * <p>
 * Whether the batch has a {@code y} side is decided by the first record. Every
 * other record must agree, else the build fails.
 * </p>
 */
public class BatchBuilder {
  
  private final Alignment alignment;
  private final boolean sortDesc;
  
  
  /**
   * Creates an instance that preserves record order.
   */
  public BatchBuilder(Alignment alignment) {
    this(alignment, false);
  }
  
  
  /**
   * @param alignment   alignment rules
   * @param sortDesc    if {@code true}, records are (stably) re-sorted by source length,
   *                    descending, before the batch is built
   */
  public BatchBuilder(Alignment alignment, boolean sortDesc) {
    this.alignment = Objects.requireNonNull(alignment, "null alignment");
    this.sortDesc = sortDesc;
  }
  
  
  public Alignment alignment() {
    return alignment;
  }
  
  
  public boolean sortDesc() {
    return sortDesc;
  }
  
  
  /**
   * Builds and returns a batch from the given records.
   * 
   * @param records non-empty list
   * 
   * @throws InvalidAlignmentException if a record violates the BOS/EOS rules, or
   *         if records disagree about having a target sequence
   */
  public Batch build(List<SeqRecord> records) throws InvalidAlignmentException {
    if (records.isEmpty())
      throw new IllegalArgumentException("empty record list");
    
    if (sortDesc) {
      records = new ArrayList<>(records);
      records.sort(Comparator.comparingInt(SeqRecord::xLen).reversed());
    }
    
    final int size = records.size();
    final boolean hasY = records.get(0).hasY();
    
    long[] ids = new long[size];
    int[][] xs = new int[size][];
    int[][] ys = hasY ? new int[size][] : null;
    
    for (int index = 0; index < size; ++index) {
      SeqRecord record = records.get(index);
      if (record.hasY() != hasY)
        throw new InvalidAlignmentException(
            "record " + record.id() + (hasY ? " has no y" : " has y") +
            ", but the first record in the batch (id " + records.get(0).id() +
            (hasY ? ") does" : ") does not"));
      ids[index] = record.id();
      xs[index] = align(record.x(), alignment.addBosX(), alignment.addEosX(), "x", record.id());
      if (hasY)
        ys[index] = align(record.y(), alignment.addBosY(), alignment.addEosY(), "y", record.id());
    }
    
    int[] xLens = lengths(xs);
    int maxXLen = max(xLens);
    int[][] xSeqs = orient(pad(xs, maxXLen));
    
    int[] yLens = null;
    int maxYLen = 0;
    int[][] ySeqs = null;
    if (hasY) {
      yLens = lengths(ys);
      maxYLen = max(yLens);
      ySeqs = orient(pad(ys, maxYLen));
    }
    
    return new Batch(ids, xSeqs, xLens, maxXLen, ySeqs, yLens, maxYLen, alignment);
  }
  
  
  /**
   * Returns the sequence with BOS / EOS inserted as needed.
   * 
   * @param seq   a copy of the record's sequence (may be returned as-is)
   */
  int[] align(int[] seq, boolean bos, boolean eos, String side, long id) {
    if (seq.length == 0)
      throw new InvalidAlignmentException("empty " + side + " sequence in record " + id);
    
    final int bosValue = alignment.bosValue();
    final int eosValue = alignment.eosValue();
    
    boolean prepend = false;
    if (bos)
      prepend = seq[0] != bosValue;
    else if (seq[0] == bosValue)
      throw new InvalidAlignmentException(
          side + " sequence in record " + id + " starts with BOS (" + bosValue +
          "), but BOS is not enabled for " + side);
    
    boolean append = false;
    final int last = seq[seq.length - 1];
    if (eos)
      append = last != eosValue;
    else if (last == eosValue)
      throw new InvalidAlignmentException(
          side + " sequence in record " + id + " ends with EOS (" + eosValue +
          "), but EOS is not enabled for " + side);
    
    if (!prepend && !append)
      return seq;
    
    int[] aligned = new int[seq.length + (prepend ? 1 : 0) + (append ? 1 : 0)];
    int offset = 0;
    if (prepend)
      aligned[offset++] = bosValue;
    System.arraycopy(seq, 0, aligned, offset, seq.length);
    if (append)
      aligned[aligned.length - 1] = eosValue;
    return aligned;
  }
  
  
  private static int[] lengths(int[][] seqs) {
    int[] lens = new int[seqs.length];
    for (int index = 0; index < seqs.length; ++index)
      lens[index] = seqs[index].length;
    return lens;
  }
  
  
  private static int max(int[] lens) {
    int max = 0;
    for (int len : lens)
      max = Math.max(max, len);
    return max;
  }
  
  
  private int[][] pad(int[][] seqs, int maxLen) {
    int[][] matrix = new int[seqs.length][];
    for (int index = 0; index < seqs.length; ++index) {
      int[] row = new int[maxLen];
      int[] seq = seqs[index];
      System.arraycopy(seq, 0, row, 0, seq.length);
      Arrays.fill(row, seq.length, maxLen, alignment.padValue());
      matrix[index] = row;
    }
    return matrix;
  }
  
  
  private int[][] orient(int[][] matrix) {
    return alignment.batchFirst() ? matrix : transpose(matrix);
  }
  
  
  /**
   * Transposes the given non-empty, rectangular matrix.
   */
  static int[][] transpose(int[][] matrix) {
    final int rows = matrix.length;
    final int cols = matrix[0].length;
    int[][] t = new int[cols][rows];
    for (int i = 0; i < rows; ++i)
      for (int j = 0; j < cols; ++j)
        t[j][i] = matrix[i][j];
    return t;
  }

}
