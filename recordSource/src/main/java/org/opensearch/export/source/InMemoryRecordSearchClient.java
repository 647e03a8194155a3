package org.opensearch.export.source;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Deterministic {@link RecordSearchClient} over records held in memory, for exercising the export
 * pipeline without a cluster.
 *
 * <p>Filtering, sorting and {@code search_after} follow the same rules as the OpenSearch client:
 * records sort on {@code updated} then {@code uid} (compared as text) and the cursor is exclusive.
 * Searches can be scripted to report timeouts or to throw.</p>
 */
public class InMemoryRecordSearchClient implements RecordSearchClient {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Comparator<ObjectNode> SORT_ORDER = Comparator
        .comparing((ObjectNode r) -> r.path(RecordFields.UPDATED).asText())
        .thenComparing(r -> r.path(RecordFields.UID).asText());

    private final List<ObjectNode> records = new CopyOnWriteArrayList<>();
    private final List<PageRequest> searchRequests = new CopyOnWriteArrayList<>();
    private final AtomicInteger pendingTimeouts = new AtomicInteger();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private volatile boolean alwaysTimeOut;
    private volatile boolean alwaysFail;

    public InMemoryRecordSearchClient addRecord(ObjectNode source) {
        records.add(source.deepCopy());
        return this;
    }

    /** Adds a minimal record with the fields the pipeline reads. */
    public InMemoryRecordSearchClient addRecord(String uid, String state, String clientId, String updated) {
        var source = objectMapper.createObjectNode();
        source.put(RecordFields.UID, uid);
        source.put(RecordFields.STATE, state);
        source.put(RecordFields.CLIENT_ID, clientId);
        source.put(RecordFields.UPDATED, updated);
        return addRecord(source);
    }

    public InMemoryRecordSearchClient timeOutNextSearches(int count) {
        pendingTimeouts.addAndGet(count);
        return this;
    }

    public InMemoryRecordSearchClient failNextSearches(int count) {
        pendingFailures.addAndGet(count);
        return this;
    }

    public InMemoryRecordSearchClient alwaysTimeOut() {
        alwaysTimeOut = true;
        return this;
    }

    public InMemoryRecordSearchClient alwaysFail() {
        alwaysFail = true;
        return this;
    }

    public List<PageRequest> getSearchRequests() {
        return Collections.unmodifiableList(searchRequests);
    }

    @Override
    public SearchPage search(PageRequest request) throws IOException {
        searchRequests.add(request);
        if (alwaysFail || pendingFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IOException("Simulated search failure");
        }
        if (alwaysTimeOut || pendingTimeouts.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return SearchPage.timedOutPage();
        }
        var page = matching(request.query()).stream()
            .filter(r -> request.isFirstPage() || isAfter(r, request.searchAfter()))
            .limit(request.size())
            .map(r -> toSearchRecord(r, request.query()))
            .collect(Collectors.toList());
        return new SearchPage(page, false);
    }

    @Override
    public long count(RecordQuery query) {
        return matching(query).size();
    }

    @Override
    public MonthlyHistogram monthlyHistogram(RecordQuery query) {
        Map<String, Long> perMonth = new TreeMap<>();
        var matching = matching(query);
        for (ObjectNode record : matching) {
            perMonth.merge(record.path(RecordFields.UPDATED).asText().substring(0, 7), 1L, Long::sum);
        }
        var buckets = perMonth.entrySet().stream()
            .map(e -> new MonthlyHistogram.Bucket(e.getKey(), e.getValue()))
            .collect(Collectors.toList());
        return new MonthlyHistogram(buckets, matching.size());
    }

    private List<ObjectNode> matching(RecordQuery query) {
        List<ObjectNode> result = new ArrayList<>();
        for (ObjectNode record : records) {
            if (matches(record, query)) {
                result.add(record);
            }
        }
        result.sort(SORT_ORDER);
        return result;
    }

    private static boolean matches(ObjectNode record, RecordQuery query) {
        var agency = record.get(RecordFields.AGENCY);
        if (agency != null && !query.agencies().contains(agency.asText())) {
            return false;
        }
        if (!query.states().contains(record.path(RecordFields.STATE).asText())) {
            return false;
        }
        if (query.hasUpdatedRange()) {
            var updated = Instant.parse(record.path(RecordFields.UPDATED).asText());
            if (query.updatedFrom() != null && updated.isBefore(query.updatedFrom())) {
                return false;
            }
            return query.updatedTo() == null || !updated.isAfter(query.updatedTo());
        }
        return true;
    }

    private static boolean isAfter(ObjectNode record, ArrayNode searchAfter) {
        int byUpdated = record.path(RecordFields.UPDATED).asText().compareTo(searchAfter.path(0).asText());
        if (byUpdated != 0) {
            return byUpdated > 0;
        }
        return record.path(RecordFields.UID).asText().compareTo(searchAfter.path(1).asText()) > 0;
    }

    private static SearchRecord toSearchRecord(ObjectNode record, RecordQuery query) {
        var sort = objectMapper.createArrayNode();
        sort.add(record.path(RecordFields.UPDATED).asText());
        sort.add(record.path(RecordFields.UID).asText());
        var source = objectMapper.createObjectNode();
        for (String field : query.sourceIncludes()) {
            JsonNode value = record.get(field);
            if (value != null) {
                source.set(field, value.deepCopy());
            }
        }
        return new SearchRecord(record.path(RecordFields.UID).asText(), sort, source);
    }
}
