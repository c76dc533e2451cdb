/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * A record's sequence violates the BOS/EOS alignment rules of a batch.
 */
@SuppressWarnings("serial")
public class InvalidAlignmentException extends SeqBatchException {

  public InvalidAlignmentException(String message) {
    super(message);
  }

}
