package org.opensearch.export.source;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.opensearch.export.source.http.AbstractRestClient;
import org.opensearch.export.source.http.HttpResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RecordSearchClient} that talks to an OpenSearch cluster over its REST API.
 *
 * <p>All three operations share one filter: {@code terms} on agency and state, and a {@code range}
 * on {@code updated} when the query has one. Searches sort on {@code updated} then {@code uid} and
 * skip total-hit tracking, which keeps deep {@code search_after} pages cheap.</p>
 */
@Slf4j
public class OpenSearchRecordClient implements RecordSearchClient {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final String HISTOGRAM_AGGREGATION = "updated";

    private final AbstractRestClient restClient;
    private final String index;
    private final Duration requestTimeout;
    private final String searchTimeout;

    /**
     * @param restClient client bound to the cluster
     * @param index the index holding the records
     * @param requestTimeout how long to wait for a response before treating the request as failed
     * @param searchTimeout server-side search timeout (e.g. {@code 60s}); null to use the cluster default.
     *                      A search that hits it comes back flagged {@code timed_out}.
     */
    public OpenSearchRecordClient(AbstractRestClient restClient, String index, Duration requestTimeout,
                                  String searchTimeout) {
        this.restClient = restClient;
        this.index = index;
        this.requestTimeout = requestTimeout;
        this.searchTimeout = searchTimeout;
    }

    @Override
    public SearchPage search(PageRequest request) throws IOException {
        var body = buildSearchBody(request);
        var response = execute(index + "/_search", body);

        if (response.path("timed_out").asBoolean(false)) {
            return SearchPage.timedOutPage();
        }
        List<SearchRecord> records = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            var source = hit.get("_source");
            var sort = hit.get("sort");
            if (!(source instanceof ObjectNode) || !(sort instanceof ArrayNode)) {
                throw new SearchBackendException("Search hit without _source or sort values: " + hit.path("_id"), 200);
            }
            records.add(new SearchRecord(hit.path("_id").asText(null), (ArrayNode) sort,
                RecordFields.project((ObjectNode) source)));
        }
        return new SearchPage(records, false);
    }

    @Override
    public long count(RecordQuery query) throws IOException {
        var body = objectMapper.createObjectNode();
        body.set("query", buildQuery(query));
        var response = execute(index + "/_count", body);
        var count = response.get("count");
        if (count == null || !count.canConvertToLong()) {
            throw new SearchBackendException("Count response without a count", 200);
        }
        return count.asLong();
    }

    @Override
    public MonthlyHistogram monthlyHistogram(RecordQuery query) throws IOException {
        var body = objectMapper.createObjectNode();
        body.put("size", 0);
        body.put("track_total_hits", true);
        body.set("query", buildQuery(query));
        var histogram = body.putObject("aggs").putObject(HISTOGRAM_AGGREGATION).putObject("date_histogram");
        histogram.put("field", RecordFields.UPDATED);
        histogram.put("calendar_interval", "month");
        histogram.put("format", "yyyy-MM");

        var response = execute(index + "/_search", body);
        if (response.path("timed_out").asBoolean(false)) {
            throw new SearchBackendException("Histogram aggregation timed out", 200);
        }
        List<MonthlyHistogram.Bucket> buckets = new ArrayList<>();
        for (JsonNode bucket : response.path("aggregations").path(HISTOGRAM_AGGREGATION).path("buckets")) {
            buckets.add(new MonthlyHistogram.Bucket(bucket.path("key_as_string").asText(),
                bucket.path("doc_count").asLong()));
        }
        long totalHits = response.path("hits").path("total").path("value").asLong();
        return new MonthlyHistogram(buckets, totalHits);
    }

    @Override
    public void close() {
        restClient.close();
    }

    ObjectNode buildSearchBody(PageRequest request) {
        var body = objectMapper.createObjectNode();
        body.put("size", request.size());
        body.put("track_total_hits", false);
        if (searchTimeout != null) {
            body.put("timeout", searchTimeout);
        }
        body.set("query", buildQuery(request.query()));
        var sort = body.putArray("sort");
        RecordFields.SORT_FIELDS.forEach(sort::add);
        var includes = body.putObject("_source").putArray("includes");
        request.query().sourceIncludes().forEach(includes::add);
        if (!request.isFirstPage()) {
            body.set("search_after", request.searchAfter());
        }
        return body;
    }

    ObjectNode buildQuery(RecordQuery query) {
        var root = objectMapper.createObjectNode();
        var bool = root.putObject("bool");
        bool.putArray("must").addObject().putObject("match_all");
        var filters = bool.putArray("filter");
        addTerms(filters, RecordFields.AGENCY, query.agencies());
        addTerms(filters, RecordFields.STATE, query.states());
        if (query.hasUpdatedRange()) {
            var range = filters.addObject().putObject("range").putObject(RecordFields.UPDATED);
            if (query.updatedFrom() != null) {
                range.put("gte", format(query.updatedFrom()));
            }
            if (query.updatedTo() != null) {
                range.put("lte", format(query.updatedTo()));
            }
        }
        return root;
    }

    private static void addTerms(ArrayNode filters, String field, List<String> values) {
        var terms = filters.addObject().putObject("terms").putArray(field);
        values.forEach(terms::add);
    }

    private static String format(Instant instant) {
        return instant.toString();
    }

    private JsonNode execute(String path, ObjectNode body) throws IOException {
        var json = objectMapper.writeValueAsString(body);
        log.atDebug().setMessage("POST {} {}").addArgument(path).addArgument(json).log();
        HttpResponse response;
        try {
            response = restClient.postAsync(path, json).block(requestTimeout);
        } catch (RuntimeException e) {
            throw new IOException("Request to " + path + " failed", e);
        }
        if (response == null) {
            throw new IOException("No response received for " + path);
        }
        if (!response.isSuccess()) {
            throw new SearchBackendException("Request to " + path + " returned " + response.statusCode()
                + " " + response.statusText() + ": " + response.body(), response.statusCode());
        }
        if (response.body() == null) {
            throw new SearchBackendException("Empty response body from " + path, response.statusCode());
        }
        return objectMapper.readTree(response.body());
    }
}
