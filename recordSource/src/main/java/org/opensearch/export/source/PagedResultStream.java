package org.opensearch.export.source;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Lazily walks every record matching a query using {@code search_after} pagination.
 *
 * <p>Records arrive in {@link RecordFields#SORT_FIELDS} order. After each page the sort values of
 * its last record become the cursor for the next request, so a resumed request starts strictly
 * after what was already delivered. The stream ends on the first empty page.</p>
 *
 * <p>A page that the backend reports as timed out, or a request that throws, is retried with the
 * cursor unchanged after a fixed backoff. The stream gives up with {@link TooManyTimeoutsException}
 * or {@link TooManyFailuresException} once either counter exceeds {@link #MAX_RETRIES}. The counters
 * belong to this stream only and are never reset by a successful page.</p>
 *
 * <p>Not thread safe. Each stream may be iterated once.</p>
 */
@Slf4j
public class PagedResultStream implements Iterable<SearchRecord>, Iterator<SearchRecord> {
    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final int MAX_RETRIES = 10;
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(10);

    private final RecordSearchClient client;
    private final RecordQuery query;
    private final int pageSize;
    private final Duration backoff;
    private final Sleeper sleeper;

    private final Deque<SearchRecord> buffered = new ArrayDeque<>();
    private ArrayNode searchAfter;
    private boolean finished;
    private boolean iteratorHandedOut;

    @Getter
    private int timeoutCount;
    @Getter
    private int failureCount;
    @Getter
    private int requestCount;

    public PagedResultStream(RecordSearchClient client, RecordQuery query) {
        this(client, query, DEFAULT_PAGE_SIZE, DEFAULT_BACKOFF, Sleeper.THREAD_SLEEP);
    }

    public PagedResultStream(RecordSearchClient client, RecordQuery query, int pageSize, Duration backoff,
                             Sleeper sleeper) {
        this.client = client;
        this.query = query;
        this.pageSize = pageSize;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    @Override
    public Iterator<SearchRecord> iterator() {
        if (iteratorHandedOut) {
            throw new IllegalStateException("A paged result stream can only be iterated once");
        }
        iteratorHandedOut = true;
        return this;
    }

    @Override
    public boolean hasNext() {
        while (buffered.isEmpty() && !finished) {
            fetchNextPage();
        }
        return !buffered.isEmpty();
    }

    @Override
    public SearchRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return buffered.poll();
    }

    private void fetchNextPage() {
        var request = new PageRequest(query, pageSize, searchAfter);
        requestCount++;
        SearchPage page;
        try {
            page = client.search(request);
        } catch (Exception e) {
            failureCount++;
            if (failureCount > MAX_RETRIES) {
                log.error("Too many failures, giving up");
                finished = true;
                throw new TooManyFailuresException(failureCount, e);
            }
            log.atWarn().setMessage("Search failed (count: {}), sleeping for {} and retrying: {}")
                .addArgument(failureCount)
                .addArgument(backoff)
                .addArgument(e::getMessage)
                .log();
            pause();
            return;
        }

        if (page.timedOut()) {
            timeoutCount++;
            log.info("Query timed out (count: {}) after cursor {}", timeoutCount, searchAfter);
            if (timeoutCount > MAX_RETRIES) {
                log.error("Too many timeouts, giving up");
                finished = true;
                throw new TooManyTimeoutsException(timeoutCount);
            }
            log.warn("Timeout, sleeping for {} and retrying", backoff);
            pause();
            return;
        }

        if (page.isEmpty()) {
            finished = true;
            return;
        }
        buffered.addAll(page.records());
        searchAfter = page.records().get(page.records().size() - 1).sortValues();
    }

    private void pause() {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = true;
            throw new PagedResultStreamException("Interrupted while waiting to retry a search", e);
        }
    }
}
