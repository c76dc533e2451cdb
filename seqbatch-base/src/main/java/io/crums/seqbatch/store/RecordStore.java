/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import io.crums.seqbatch.SeqRecord;

/**
 * A durable (or cached) source of {@linkplain SeqRecord}s. Each call to
 * {@linkplain #iterator()} is an independent pass over the store; the order of
 * records in a pass is determined by the store's configured read policy, and
 * may differ from pass to pass.
 * 
 * <h2>Concurrency</h2>
 * <p>
 * Stores are not required to be thread-safe: a store (and the iterables built
 * on it) should be driven from one consumer thread.
 * </p>
 * 
 * @see IndexedRecordStore
 */
public interface RecordStore extends Iterable<SeqRecord>, AutoCloseable {
  
  
  /**
   * Returns the number of records in the store. For streaming stores this
   * may be an upper bound (e.g. the line count of a file, some lines of which
   * may later be filtered out).
   * 
   * @return &ge; 0
   */
  long size();
  
  
  /**
   * Starts a new pass over the store.
   */
  @Override
  CloseableIterator<SeqRecord> iterator();
  
  
  /**
   * Releases the store's underlying resources. The default is a no-op.
   */
  @Override
  default void close() {  }

}
