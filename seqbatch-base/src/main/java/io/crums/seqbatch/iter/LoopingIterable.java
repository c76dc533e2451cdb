/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.iter;


import static io.crums.seqbatch.SeqBatchConstants.logDebug;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

import io.crums.seqbatch.SeqBatchException;
import io.crums.seqbatch.store.CloseableIterator;

/**
 * Replays passes of an underlying iterable until a target number of items
 * (batches, typically) has been emitted. Each wrap-around starts a fresh pass
 * of the source, so a randomized source yields a different order every time.
 * Iteration stops at exactly the target count, mid-pass if need be.
 *
 * <h2>Running Count</h2>
 * <p>
 * The count of items emitted is kept by the instance, not the iterator: a
 * consumer that stops early and later calls {@linkplain #iterator()} again
 * resumes counting where it left off (from a fresh source pass), and no item
 * is ever emitted past the target.
 * </p>
 *
 * @param <T> item type
 */
public class LoopingIterable<T> implements Iterable<T> {

  private final Iterable<T> source;
  private final long total;

  private long count;
  private long passes;


  /**
   * @param source  the iterable replayed
   * @param total   the total number of items to emit (&ge; 0)
   */
  public LoopingIterable(Iterable<T> source, long total) {
    this.source = Objects.requireNonNull(source, "null source");
    if (total < 0)
      throw new IllegalArgumentException("total " + total);
    this.total = total;
  }


  /** Returns the target count. */
  public long total() {
    return total;
  }

  /** Returns the number of items emitted so far. */
  public long count() {
    return count;
  }

  /** Returns the number of source passes started so far. */
  public long passes() {
    return passes;
  }


  /**
   * {@inheritDoc}
   *
   * @throws SeqBatchException (on iteration) if a source pass yields nothing
   */
  @Override
  public CloseableIterator<T> iterator() {
    return new LoopIterator();
  }



  private class LoopIterator implements CloseableIterator<T> {

    private Iterator<T> pass;
    private long passYield;

    @Override
    public boolean hasNext() {
      if (count >= total) {
        close();
        return false;
      }
      while (true) {
        if (pass == null) {
          pass = source.iterator();
          passYield = 0;
          ++passes;
          logDebug("starting pass " + passes + " at count " + count);
        }
        if (pass.hasNext())
          return true;
        close();
        if (passYield == 0)
          throw new SeqBatchException(
              "source pass " + passes + " yielded nothing; " + count + " of " + total + " emitted");
      }
    }

    @Override
    public T next() {
      if (!hasNext())
        throw new NoSuchElementException();
      T item = pass.next();
      ++count;
      ++passYield;
      return item;
    }

    @Override
    public void close() {
      if (pass instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (RuntimeException rx) {
          throw rx;
        } catch (Exception x) {
          throw new SeqBatchException("on closing source pass: " + x, x);
        }
      }
      pass = null;
    }
  }

}
