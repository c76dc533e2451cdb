/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * The source and target files of a parallel corpus have unequal line counts.
 */
@SuppressWarnings("serial")
public class CorpusMismatchException extends SeqBatchException {

  public CorpusMismatchException(String message) {
    super(message);
  }

}
