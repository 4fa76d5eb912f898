package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.graph.dto.GraphPage;
import dk.trustworks.filebridge.graph.dto.GraphPaging;
import lombok.extern.jbosslog.JBossLog;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy, single-pass sequence over a paged Graph listing.
 *
 * <p>Pages are fetched on demand by following the continuation cursor of the previous page,
 * until the listing is exhausted or {@code maxPages} pages have been read. When the cap stops
 * the iteration early, {@link #nextCursor()} returns the cursor of the first unread page.
 * Not restartable: start a new listing to read from the beginning.
 */
@JBossLog
public class PagedIterator<T> implements Iterator<T> {

    private final Function<String, ? extends GraphPage<T>> fetcher;
    private final int maxPages;

    private Iterator<T> current = null;
    private String cursor;
    private boolean exhausted = false;
    private int pagesRead = 0;

    /**
     * @param fetcher fetches the page at a cursor; the first call receives {@code startCursor}
     * @param startCursor cursor of the first page, null for the beginning of the listing
     * @param maxPages maximum number of pages to read, at least 1
     */
    public PagedIterator(Function<String, ? extends GraphPage<T>> fetcher, String startCursor, int maxPages) {
        this.fetcher = fetcher;
        this.cursor = startCursor;
        this.maxPages = Math.max(1, maxPages);
    }

    @Override
    public boolean hasNext() {
        while (current == null || !current.hasNext()) {
            if (exhausted || pagesRead >= maxPages) {
                return false;
            }
            GraphPage<T> page = fetcher.apply(cursor);
            pagesRead++;
            current = page.items().iterator();
            if (page.hasNext()) {
                cursor = GraphPaging.skipToken(page.odataNextLink());
                exhausted = cursor == null;
                if (exhausted) {
                    log.warnf("Next link without continuation token, stopping after page %d: %s",
                        pagesRead, page.odataNextLink());
                }
            } else {
                cursor = null;
                exhausted = true;
            }
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    public int getPagesRead() {
        return pagesRead;
    }

    /**
     * Cursor of the first page that was not read because of the page cap, or null when the
     * listing was read to the end (or has not been read yet).
     */
    public String nextCursor() {
        return exhausted ? null : (pagesRead >= maxPages ? cursor : null);
    }
}
