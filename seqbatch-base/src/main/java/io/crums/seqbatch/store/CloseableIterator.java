/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * An iterator that may hold a file or database resource. Iteration is
 * pull-based: a consumer that stops early should {@linkplain #close() close}
 * the iterator (ideally in a try-with-resources block). Exhausting the
 * iterator releases its resources as well.
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

  /**
   * Releases any underlying resource. Idempotent. Does not throw checked
   * exceptions.
   */
  @Override
  void close();
  
  
  /**
   * Returns a resource-free instance over the given list.
   */
  static <T> CloseableIterator<T> of(List<T> list) {
    return wrap(list.iterator());
  }
  
  
  /**
   * Returns a resource-free (no-op {@code close()}) view of the given iterator.
   */
  static <T> CloseableIterator<T> wrap(Iterator<T> iter) {
    return new CloseableIterator<T>() {
      @Override
      public boolean hasNext() {
        return iter.hasNext();
      }
      @Override
      public T next() {
        return iter.next();
      }
      @Override
      public void close() {  }
    };
  }
  
  
  /**
   * Returns an empty instance.
   */
  static <T> CloseableIterator<T> empty() {
    return new CloseableIterator<T>() {
      @Override
      public boolean hasNext() {
        return false;
      }
      @Override
      public T next() {
        throw new NoSuchElementException();
      }
      @Override
      public void close() {  }
    };
  }

}
