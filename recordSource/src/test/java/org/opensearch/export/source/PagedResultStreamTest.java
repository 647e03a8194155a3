package org.opensearch.export.source;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PagedResultStreamTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private PagedResultStream stream(InMemoryRecordSearchClient client, int pageSize) {
        return new PagedResultStream(client, RecordQuery.defaults(), pageSize, Duration.ofSeconds(10), sleeps::add);
    }

    private static InMemoryRecordSearchClient clientWithRecords(int count) {
        var client = new InMemoryRecordSearchClient();
        // Added out of order, several records share a timestamp
        for (int i = count - 1; i >= 0; i--) {
            client.addRecord(String.format("10.5555/rec-%02d", i), "findable", "client.a",
                "2024-01-0" + (1 + i / 4) + "T00:00:00Z");
        }
        return client;
    }

    private static List<String> uids(Iterable<SearchRecord> records) {
        List<String> uids = new ArrayList<>();
        records.forEach(r -> uids.add(r.uid()));
        return uids;
    }

    @Test
    void resumesAfterEachPageWithoutDuplicatesOrGaps() {
        var client = clientWithRecords(10);

        var uids = uids(stream(client, 3));

        assertEquals(10, uids.size());
        assertEquals(10, new HashSet<>(uids).size());
        var expected = new ArrayList<>(uids);
        expected.sort(String::compareTo);
        assertEquals(expected, uids, "records must arrive in updated, uid order");
        // 4 pages of data (3+3+3+1) and the terminating empty page
        assertEquals(5, client.getSearchRequests().size());
        assertNull(client.getSearchRequests().get(0).searchAfter());
        assertEquals("10.5555/rec-02", client.getSearchRequests().get(1).searchAfter().get(1).asText());
    }

    @Test
    void emptyResultEndsImmediately() {
        var client = new InMemoryRecordSearchClient();

        var resultStream = stream(client, 3);

        assertFalse(resultStream.hasNext());
        assertEquals(1, resultStream.getRequestCount());
    }

    @Test
    void giveUpAfterElevenTimedOutAttempts() {
        var client = clientWithRecords(3).alwaysTimeOut();
        var resultStream = stream(client, 3);

        var e = assertThrows(TooManyTimeoutsException.class, resultStream::hasNext);

        assertNotNull(e.getMessage());
        assertEquals(11, client.getSearchRequests().size());
        assertEquals(11, resultStream.getTimeoutCount());
        assertEquals(10, sleeps.size());
        assertTrue(sleeps.stream().allMatch(d -> d.equals(Duration.ofSeconds(10))));
    }

    @Test
    void giveUpAfterElevenFailedAttempts() {
        var client = clientWithRecords(3).alwaysFail();
        var resultStream = stream(client, 3);

        var e = assertThrows(TooManyFailuresException.class, resultStream::hasNext);

        assertNotNull(e.getCause());
        assertEquals(11, client.getSearchRequests().size());
        assertEquals(10, sleeps.size());
    }

    @Test
    void transientProblemsRetryTheSamePage() {
        var client = clientWithRecords(6);
        var resultStream = stream(client, 3);

        assertEquals("10.5555/rec-00", resultStream.next().uid());
        resultStream.next();
        resultStream.next();
        client.timeOutNextSearches(2).failNextSearches(1);

        var rest = new ArrayList<String>();
        resultStream.forEachRemaining(r -> rest.add(r.uid()));

        assertEquals(List.of("10.5555/rec-03", "10.5555/rec-04", "10.5555/rec-05"), rest);
        var retriedCursors = client.getSearchRequests().subList(1, 5).stream()
            .map(r -> r.searchAfter().get(1).asText())
            .collect(Collectors.toSet());
        assertEquals(1, retriedCursors.size(), "retries must reuse the cursor");
        assertEquals(2, resultStream.getTimeoutCount());
        assertEquals(1, resultStream.getFailureCount());
        assertEquals(3, sleeps.size());
    }

    @Test
    void countersAccumulateAcrossSuccessfulPages() {
        var client = clientWithRecords(9);
        var resultStream = stream(client, 3);

        client.timeOutNextSearches(6);
        resultStream.next();
        for (int i = 0; i < 2; i++) {
            resultStream.next();
        }
        client.timeOutNextSearches(5);

        assertThrows(TooManyTimeoutsException.class, () -> resultStream.forEachRemaining(r -> { }));
        assertEquals(11, resultStream.getTimeoutCount());
    }

    @Test
    void interruptedBackoffAbortsTheStream() {
        var client = clientWithRecords(3).timeOutNextSearches(1);
        var resultStream = new PagedResultStream(client, RecordQuery.defaults(), 3, Duration.ofSeconds(1), d -> {
            throw new InterruptedException();
        });

        try {
            assertThrows(PagedResultStreamException.class, resultStream::hasNext);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void streamCanOnlyBeIteratedOnce() {
        var resultStream = stream(clientWithRecords(1), 3);
        resultStream.iterator();

        assertThrows(IllegalStateException.class, resultStream::iterator);
    }
}
