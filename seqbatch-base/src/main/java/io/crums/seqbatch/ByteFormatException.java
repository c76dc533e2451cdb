/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


/**
 * When nonsensical binary data is encountered, this exception is thrown.
 */
@SuppressWarnings("serial")
public class ByteFormatException extends SeqBatchException {

  public ByteFormatException(String message) {
    super(message);
  }

  public ByteFormatException(String message, Throwable cause) {
    super(message, cause);
  }

}
