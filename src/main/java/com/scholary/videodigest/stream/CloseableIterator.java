package com.scholary.videodigest.stream;

import java.util.Iterator;

/**
 * An iterator over a resource that must be released when the consumer is done with it, including
 * when the consumer stops before exhaustion.
 *
 * <p>{@link #close()} is idempotent and never throws a checked exception.
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

  @Override
  void close();

  /** Wrap an iterator that holds no resource; closing it does nothing. */
  static <T> CloseableIterator<T> of(Iterator<T> iterator) {
    return new CloseableIterator<>() {
      @Override
      public boolean hasNext() {
        return iterator.hasNext();
      }

      @Override
      public T next() {
        return iterator.next();
      }

      @Override
      public void close() {}
    };
  }
}
