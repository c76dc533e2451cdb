/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * Base exception in the <code>seqbatch</code> modules. Structural problems
 * (ids, schema, corpus alignment, configuration) are reported with
 * this type or one of its subclasses and are never recovered from locally.
 */
@SuppressWarnings("serial")
public class SeqBatchException extends RuntimeException {

  public SeqBatchException(String message) {
    super(message);
  }

  public SeqBatchException(Throwable cause) {
    super(cause);
  }

  public SeqBatchException(String message, Throwable cause) {
    super(message, cause);
  }

}
