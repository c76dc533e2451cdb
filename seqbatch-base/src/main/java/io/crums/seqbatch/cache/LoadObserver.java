/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.cache;


import static io.crums.seqbatch.SeqBatchConstants.logInfo;

/**
 * Observes the progress of materializing a store into memory. Observers are
 * informational: they cannot stop the load.
 * 
 * @see InMemoryStore#InMemoryStore(io.crums.seqbatch.store.RecordStore, LoadObserver)
 */
public interface LoadObserver {
  
  /**
   * Does nothing.
   */
  LoadObserver NOOP = (count, usedMemory) -> {  };
  
  
  /**
   * Invoked every {@linkplain #interval()} records, and once more at the end.
   * 
   * @param count       number of records loaded so far
   * @param usedMemory  JVM heap in use, in bytes
   */
  void loaded(long count, long usedMemory);
  
  
  /**
   * Returns the number of records between notifications. Defaults to 1000.
   */
  default int interval() {
    return 1000;
  }
  
  
  /**
   * Returns an observer that logs (at INFO level) every {@code interval} records.
   */
  static LoadObserver logging(int interval) {
    if (interval < 1)
      throw new IllegalArgumentException("interval " + interval);
    return new LoadObserver() {
      @Override
      public void loaded(long count, long usedMemory) {
        logInfo("loaded " + count + " records; memory used " + (usedMemory >> 20) + " MB");
      }
      @Override
      public int interval() {
        return interval;
      }
    };
  }

}
