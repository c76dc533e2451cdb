/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * Random access by id found no record for one or more requested ids.
 */
@SuppressWarnings("serial")
public class MissingRecordException extends SeqBatchException {

  public MissingRecordException(String message) {
    super(message);
  }

}
