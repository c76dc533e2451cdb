/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.sql;

import java.sql.SQLException;

import io.crums.seqbatch.SeqBatchException;

/**
 * Usually wraps an {@linkplain SQLException}. Also thrown when an existing
 * database doesn't have the expected schema.
 */
@SuppressWarnings("serial")
public class SqlStoreException extends SeqBatchException {

  public SqlStoreException(String message) {
    super(message);
  }

  public SqlStoreException(String message, Throwable cause) {
    super(message, cause);
  }

}
