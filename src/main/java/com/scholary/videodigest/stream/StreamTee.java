package com.scholary.videodigest.stream;

import com.scholary.videodigest.logging.StructuredLogger;
import com.scholary.videodigest.store.ResultStoreFile;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.LoggerFactory;

/**
 * Forwards a lazily produced sequence of text fragments while keeping a copy of them.
 *
 * <p>Consumption is driven by the caller: every {@code next()} pulls exactly one fragment from
 * upstream, buffers it and hands it on unchanged. When upstream reports exhaustion, the buffer is
 * joined and, if the sink says so, written into the store and persisted. The commit happens inside
 * the {@code hasNext()} call that observes the end, before the consumer sees completion, and at
 * most once.
 *
 * <p>A consumer that stops pulling early never triggers the commit, so partial results are not
 * persisted. Such a consumer closes the returned iterator, which releases upstream without
 * committing.
 */
public class StreamTee {

  private static final StructuredLogger STRUCTURED_LOGGER =
      new StructuredLogger(LoggerFactory.getLogger(StreamTee.class));

  private final ResultStoreFile storeFile;

  public StreamTee(ResultStoreFile storeFile) {
    this.storeFile = storeFile;
  }

  /**
   * Tee {@code fragments} into {@code sink}.
   *
   * @param fragments upstream fragments, pulled one at a time
   * @param sink commit target for the joined text
   * @return an iterator that yields the same fragments in the same order; closing it closes
   *     {@code fragments}
   */
  public CloseableIterator<String> tee(CloseableIterator<String> fragments, StoreSink sink) {
    return new TeeIterator(fragments, sink);
  }

  private final class TeeIterator implements CloseableIterator<String> {

    private final CloseableIterator<String> upstream;
    private final StoreSink sink;
    private final List<String> buffer = new ArrayList<>();
    private boolean finished;

    private TeeIterator(CloseableIterator<String> upstream, StoreSink sink) {
      this.upstream = upstream;
      this.sink = sink;
    }

    @Override
    public boolean hasNext() {
      if (finished) {
        return false;
      }
      if (upstream.hasNext()) {
        return true;
      }
      finished = true;
      try {
        commit();
      } finally {
        upstream.close();
      }
      return false;
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException("Stream exhausted");
      }
      String fragment = upstream.next();
      if (fragment == null) {
        fragment = "";
      }
      buffer.add(fragment);
      return fragment;
    }

    @Override
    public void close() {
      if (!finished) {
        finished = true;
        if (!buffer.isEmpty()) {
          STRUCTURED_LOGGER.logCommitSkipped(sink.keyPath(), String.join("", buffer).length());
        }
        buffer.clear();
      }
      upstream.close();
    }

    private void commit() {
      String joined = String.join("", buffer);
      buffer.clear();
      if (!sink.store()) {
        STRUCTURED_LOGGER.logCommitSkipped(sink.keyPath(), joined.length());
        return;
      }
      sink.resultStore().set(sink.keyPath(), joined);
      storeFile.persist(sink.resultStore(), sink.path());
      STRUCTURED_LOGGER.logResultCommitted(sink.keyPath(), joined.length());
    }
  }
}
