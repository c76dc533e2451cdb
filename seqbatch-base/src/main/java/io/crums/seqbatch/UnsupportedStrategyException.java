/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * A bucketing strategy or read order was requested against a backend that cannot support it.
 */
@SuppressWarnings("serial")
public class UnsupportedStrategyException extends SeqBatchException {

  public UnsupportedStrategyException(String message) {
    super(message);
  }

}
