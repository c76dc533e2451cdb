/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.batch;


/**
 * Alignment rules for building a {@linkplain Batch}: which sides get
 * BOS (begin-of-sequence) and EOS (end-of-sequence) markers, the orientation
 * of the matrices, and the pad / BOS / EOS values. BOS and EOS may share a
 * value.
 * 
 * @param addBosX     source must start with BOS (inserted, if missing)
 * @param addEosX     source must end with EOS (inserted, if missing)
 * @param addBosY     target must start with BOS (inserted, if missing)
 * @param addEosY     target must end with EOS (inserted, if missing)
 * @param batchFirst  if {@code true}, matrices are {@code [batch, seq]}; otherwise
 *                    {@code [seq, batch]}
 * @param padValue    pad value
 * @param bosValue    BOS value
 * @param eosValue    EOS value
 */
public record Alignment(
    boolean addBosX, boolean addEosX,
    boolean addBosY, boolean addEosY,
    boolean batchFirst,
    int padValue, int bosValue, int eosValue) {
  
  
  /**
   * Returns an instance with the customary settings: EOS on both sides, no BOS,
   * batch-major.
   */
  public static Alignment of(int padValue, int bosValue, int eosValue) {
    return new Alignment(false, true, false, true, true, padValue, bosValue, eosValue);
  }
  
  
  public Alignment withBos(boolean x, boolean y) {
    return new Alignment(x, addEosX, y, addEosY, batchFirst, padValue, bosValue, eosValue);
  }
  
  public Alignment withEos(boolean x, boolean y) {
    return new Alignment(addBosX, x, addBosY, y, batchFirst, padValue, bosValue, eosValue);
  }
  
  public Alignment withBatchFirst(boolean batchFirst) {
    return new Alignment(addBosX, addEosX, addBosY, addEosY, batchFirst, padValue, bosValue, eosValue);
  }

}
