package org.opensearch.export.source;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;

/**
 * Filter applied to every request against the record index: the agencies and lifecycle states
 * that are exported, an optional inclusive range on the {@code updated} timestamp, and the field
 * allow-list requested from {@code _source}.
 */
@Builder(toBuilder = true)
public record RecordQuery(
    @NonNull List<String> agencies,
    @NonNull List<String> states,
    Instant updatedFrom,
    Instant updatedTo,
    @NonNull List<String> sourceIncludes
) {
    public static final List<String> DEFAULT_AGENCIES = List.of("DataCite", "datacite");
    public static final List<String> DEFAULT_STATES = List.of(RecordFields.FINDABLE_STATE, "registered");

    /** The query every export starts from: all findable or registered records of the default agencies. */
    public static RecordQuery defaults() {
        return RecordQuery.builder()
            .agencies(DEFAULT_AGENCIES)
            .states(DEFAULT_STATES)
            .sourceIncludes(RecordFields.EXPORTED_FIELDS)
            .build();
    }

    /** Restrict to records updated within the inclusive range. */
    public RecordQuery withUpdatedRange(Instant from, Instant to) {
        return toBuilder().updatedFrom(from).updatedTo(to).build();
    }

    public boolean hasUpdatedRange() {
        return updatedFrom != null || updatedTo != null;
    }
}
