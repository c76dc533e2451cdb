/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * Two records in a store share the same id. Indicates a corrupt store.
 */
@SuppressWarnings("serial")
public class DuplicateIdException extends SeqBatchException {

  public DuplicateIdException(String message) {
    super(message);
  }

}
