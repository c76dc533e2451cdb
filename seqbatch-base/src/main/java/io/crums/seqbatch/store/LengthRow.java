/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import io.crums.seqbatch.SeqRecord;

/**
 * The {@code (id, x_len, y_len)} column projection of a record.
 * 
 * @param id    record id
 * @param xLen  source length
 * @param yLen  target length, or {@code -1} if the record has no target
 */
public record LengthRow(long id, int xLen, int yLen) {
  
  
  public static LengthRow of(SeqRecord record) {
    return new LengthRow(record.id(), record.xLen(), record.yLen());
  }
  
  
  /**
   * Returns the length that counts against a token budget: the greater of
   * the two lengths.
   */
  public int maxLen() {
    return Math.max(xLen, yLen);
  }
  
  
  /**
   * Returns {@code true} if the source is empty or the target is present but
   * empty.
   */
  public boolean hasEmptySide() {
    return xLen == 0 || yLen == 0;
  }
  
}
