/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import java.util.List;

import io.crums.seqbatch.MissingRecordException;
import io.crums.seqbatch.SeqRecord;

/**
 * A {@linkplain RecordStore} that supports a lightweight, column-only
 * projection sorted by length, and random access by id. Together these let
 * batch membership be decided from the lengths alone, with full records
 * deserialized only once, when each batch is built.
 */
public interface IndexedRecordStore extends RecordStore {
  
  
  /**
   * Returns the {@code (id, x_len, y_len)} projection of every record in the
   * store, in the given order.
   * 
   * @param order the sort policy
   * 
   * @return non-null, possibly empty list
   */
  List<LengthRow> lengthIndex(ReadOrder order);
  
  
  /**
   * Returns the records with the given ids, in the given order. Exactly one
   * record is returned per requested id.
   * 
   * @param ids   record ids
   * 
   * @throws MissingRecordException if any of the {@code ids} is not in the store
   */
  List<SeqRecord> getByIds(long[] ids) throws MissingRecordException;

}
