package com.example.resilientsecrets.core.listing;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.store.Page;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable view over a paginated listing.
 *
 * <p>Each {@link #iterator()} starts again from the first page; it is not resumed mid-stream. An
 * iterator holds only the current page and its continuation token, fetching the next page when the
 * current one is exhausted, and ends when the store returns no token.
 *
 * <p>{@link #prefetch()} reads the first page eagerly, so the caller sees a failure of the first
 * fetch immediately; the next iterator starts from that page instead of fetching it again.
 *
 * <p>There is no snapshot isolation. Every item present when iteration starts and not removed
 * while it runs is returned exactly once; items created during iteration may or may not appear.
 *
 * @param <T> item type
 */
public final class PagedIterable<T> implements Iterable<T> {

  private final PageFetcher<T> fetcher;
  private final AtomicReference<Page<T>> firstPage = new AtomicReference<>();

  public PagedIterable(final PageFetcher<T> fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  /**
   * Fetches the first page now. Only the next {@link #iterator()} reuses it; later iterators fetch
   * from the start again.
   *
   * @return this iterable
   */
  public PagedIterable<T> prefetch() {
    firstPage.set(fetcher.fetch(null));
    return this;
  }

  @Override
  public Iterator<T> iterator() {
    return new PageIterator(firstPage.getAndSet(null));
  }

  /**
   * Returns a sequential stream over a fresh iteration.
   *
   * @return lazy stream
   */
  public Stream<T> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  /**
   * Fetches one page given the previous page's continuation token.
   *
   * @param <T> item type
   */
  @FunctionalInterface
  public interface PageFetcher<T> {
    /**
     * @param pageToken continuation token, null for the first page
     * @return the page
     */
    Page<T> fetch(String pageToken);
  }

  private final class PageIterator implements Iterator<T> {
    private Iterator<T> current = Collections.emptyIterator();
    private String nextToken;
    private boolean started;

    private PageIterator(final Page<T> first) {
      if (first == null) return;
      current = first.items().iterator();
      nextToken = first.nextPageToken();
      started = true;
    }

    @Override
    public boolean hasNext() {
      while (!current.hasNext()) {
        if (started && nextToken == null) return false;

        final var requested = nextToken;
        final var page = fetcher.fetch(requested);
        started = true;
        if (requested != null && requested.equals(page.nextPageToken()))
          throw new StoreAccessException(
              ErrorKind.UNKNOWN, "Store returned a non-advancing page token");
        nextToken = page.nextPageToken();
        current = page.items().iterator();
      }
      return true;
    }

    @Override
    public T next() {
      if (!hasNext()) throw new NoSuchElementException();
      return current.next();
    }
  }
}
