/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.iter;


import static io.crums.seqbatch.SeqBatchConstants.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;

import io.crums.seqbatch.BatchOverflowException;
import io.crums.seqbatch.SeqBatchException;
import io.crums.seqbatch.SeqRecord;
import io.crums.seqbatch.UnsupportedStrategyException;
import io.crums.seqbatch.batch.Batch;
import io.crums.seqbatch.batch.BatchBuilder;
import io.crums.seqbatch.store.CloseableIterator;
import io.crums.seqbatch.store.IndexedRecordStore;
import io.crums.seqbatch.store.LengthRow;
import io.crums.seqbatch.store.ReadOrder;
import io.crums.seqbatch.store.RecordStore;

/**
 * Turns a {@linkplain RecordStore} into passes of token-budgeted
 * {@linkplain Batch}es. Each call to {@linkplain #iterator()} is a new pass.
 *
 * <h2>Bucketing</h2>
 * <p>
 * A record's budget length is the greater of its source and target lengths.
 * A bucket of {@code n} records with maximum length {@code m} satisfies
 * {@code n * m <= budget}. A record longer than the budget cannot be batched
 * and fails the pass with a {@linkplain BatchOverflowException}. Records with
 * an empty side are skipped with a warning.
 * </p>
 * <ol>
 * <li>{@linkplain Bucketing#SEQUENTIAL}: records are packed greedily in store
 * order. Membership is a deterministic function of store order and budget.</li>
 * <li>{@linkplain Bucketing#EQ_LEN_RANDOM}: buckets are formed from the store's
 * length projection in {@linkplain ReadOrder#EQ_LEN_RAND_BATCH} order, without
 * deserializing any sequences. The order of the buckets is then shuffled, and
 * each bucket's records are fetched by id as it's reached. Requires an
 * {@linkplain IndexedRecordStore}.</li>
 * </ol>
 * <p>
 * Either way, no record is split across batches, and every record that
 * survived ingestion appears in exactly one batch per pass.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Instances are stateful (random source, store cursors) and must not be shared
 * across consumer threads.
 * </p>
 */
public class BatchIterable implements Iterable<Batch>, AutoCloseable {

  private final RecordStore store;
  private final BatchBuilder builder;
  private final Bucketing bucketing;
  private final Random random;
  private final int tokenBudget;


  /**
   * Creates a {@linkplain Bucketing#SEQUENTIAL sequential} instance.
   */
  public BatchIterable(RecordStore store, int tokenBudget, BatchBuilder builder) {
    this(store, tokenBudget, builder, Bucketing.SEQUENTIAL, new Random());
  }


  /**
   * @param store       the record store
   * @param tokenBudget maximum {@code record_count * max_length} per batch (&ge; 1)
   * @param builder     batch builder
   * @param bucketing   the bucketing strategy
   * @param random      random source for shuffling bucket order
   *
   * @throws UnsupportedStrategyException if {@code bucketing} is
   *         {@linkplain Bucketing#EQ_LEN_RANDOM} and the store is not an
   *         {@linkplain IndexedRecordStore}
   */
  public BatchIterable(
      RecordStore store, int tokenBudget, BatchBuilder builder,
      Bucketing bucketing, Random random) throws UnsupportedStrategyException {

    this.store = Objects.requireNonNull(store, "null store");
    this.builder = Objects.requireNonNull(builder, "null builder");
    this.bucketing = Objects.requireNonNull(bucketing, "null bucketing");
    this.random = Objects.requireNonNull(random, "null random");
    if (tokenBudget < 1)
      throw new IllegalArgumentException("tokenBudget " + tokenBudget);
    this.tokenBudget = tokenBudget;

    if (bucketing == Bucketing.EQ_LEN_RANDOM && !(store instanceof IndexedRecordStore))
      throw new UnsupportedStrategyException(
          bucketing.symbol() + " bucketing requires an indexed store; " +
          store.getClass().getSimpleName() + " can't sort by length columns");

    logInfo("batch size = " + tokenBudget + " toks, bucketing=" + bucketing.symbol());
  }


  public RecordStore store() {
    return store;
  }


  public Bucketing bucketing() {
    return bucketing;
  }


  public int tokenBudget() {
    return tokenBudget;
  }


  /**
   * Returns the number of records in the store.
   */
  public long numItems() {
    return store.size();
  }


  /**
   * Returns an <em>estimate</em> of the number of batches in a pass:
   * {@code ceil(numItems / tokenBudget)}. The actual count depends on the
   * length distribution.
   */
  public long numBatches() {
    long items = numItems();
    return (items + tokenBudget - 1) / tokenBudget;
  }


  @Override
  public CloseableIterator<Batch> iterator() {
    return bucketing == Bucketing.SEQUENTIAL ?
        new SequentialIterator() : eqLenRandomIterator();
  }


  /**
   * Closes the underlying store.
   */
  @Override
  public void close() {
    store.close();
  }



  private static void warnSkip(long id, int xLen, int yLen) {
    logWarning(
        "skipping record " + id + ": either source or target is empty (x_len:" +
        xLen + " y_len:" + yLen + ")");
  }



  /**
   * Computes the buckets (as record ids) for an equal-length randomized pass.
   */
  List<long[]> eqLenBuckets() {
    var indexed = (IndexedRecordStore) store;
    List<LengthRow> rows = indexed.lengthIndex(ReadOrder.EQ_LEN_RAND_BATCH);

    var buckets = new ArrayList<long[]>();
    var bucketer = new TokenBucketer(tokenBudget);
    var ids = new ArrayList<Long>();
    for (LengthRow row : rows) {
      if (row.hasEmptySide()) {
        warnSkip(row.id(), row.xLen(), row.yLen());
        continue;
      }
      if (!bucketer.offer(row.id(), row.xLen(), row.yLen())) {
        buckets.add(toArray(ids));
        ids.clear();
      }
      ids.add(row.id());
    }
    if (!ids.isEmpty())
      buckets.add(toArray(ids));
    return buckets;
  }


  private static long[] toArray(List<Long> ids) {
    long[] array = new long[ids.size()];
    for (int index = 0; index < array.length; ++index)
      array[index] = ids.get(index);
    return array;
  }


  private CloseableIterator<Batch> eqLenRandomIterator() {
    List<long[]> buckets = eqLenBuckets();
    if (buckets.isEmpty())
      throw new SeqBatchException("found no training data in " + store);
    logInfo("length sorted random batches = " + buckets.size() + ". shuffling..");
    Collections.shuffle(buckets, random);

    var indexed = (IndexedRecordStore) store;
    var bucketIter = buckets.iterator();
    return new CloseableIterator<Batch>() {
      @Override
      public boolean hasNext() {
        return bucketIter.hasNext();
      }
      @Override
      public Batch next() {
        long[] ids = bucketIter.next();
        return builder.build(indexed.getByIds(ids));
      }
      @Override
      public void close() {  }
    };
  }



  /**
   * Lazily packs records in store order.
   */
  private class SequentialIterator implements CloseableIterator<Batch> {

    private final TokenBucketer bucketer = new TokenBucketer(tokenBudget);
    private CloseableIterator<SeqRecord> source = store.iterator();
    private List<SeqRecord> pending = new ArrayList<>();
    private Batch next;

    @Override
    public boolean hasNext() {
      try {
        while (next == null && source != null) {
          if (!source.hasNext()) {
            close();
            if (!pending.isEmpty()) {
              logDebug("last batch, size=" + pending.size());
              next = flush();
            }
            break;
          }
          SeqRecord record = source.next();
          if (record.hasEmptySide()) {
            warnSkip(record.id(), record.xLen(), record.yLen());
            continue;
          }
          if (!bucketer.offer(record.id(), record.xLen(), record.yLen()))
            next = flush();
          pending.add(record);
        }
      } catch (RuntimeException x) {
        close();
        throw x;
      }
      return next != null;
    }


    private Batch flush() {
      Batch batch = builder.build(pending);
      pending = new ArrayList<>();
      return batch;
    }


    @Override
    public Batch next() {
      if (!hasNext())
        throw new NoSuchElementException();
      Batch batch = next;
      next = null;
      return batch;
    }


    @Override
    public void close() {
      if (source != null) {
        source.close();
        source = null;
      }
    }
  }

}
