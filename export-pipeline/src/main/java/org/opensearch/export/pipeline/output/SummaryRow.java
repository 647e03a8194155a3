package org.opensearch.export.pipeline.output;

import org.opensearch.export.source.SearchRecord;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** One row of the per-month tabular summary. */
@JsonPropertyOrder({"doi", "state", "client_id", "updated"})
public record SummaryRow(
    @JsonProperty("doi") String doi,
    @JsonProperty("state") String state,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("updated") String updated
) {
    public static SummaryRow of(SearchRecord record) {
        return new SummaryRow(record.uid(), record.state(), record.clientId(), record.updated());
    }
}
