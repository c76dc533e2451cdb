/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * A single record is longer than the token budget of the batches being built.
 */
@SuppressWarnings("serial")
public class BatchOverflowException extends SeqBatchException {

  public BatchOverflowException(String message) {
    super(message);
  }

}
