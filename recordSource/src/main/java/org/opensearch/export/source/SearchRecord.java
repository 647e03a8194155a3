package org.opensearch.export.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;

/**
 * One hit of a search: its document id, the sort values that make it resumable, and its source.
 */
public record SearchRecord(String id, @NonNull ArrayNode sortValues, @NonNull ObjectNode source) {

    public String uid() {
        return text(RecordFields.UID);
    }

    public String state() {
        return text(RecordFields.STATE);
    }

    public String clientId() {
        return text(RecordFields.CLIENT_ID);
    }

    public String updated() {
        return text(RecordFields.UPDATED);
    }

    public boolean isFindable() {
        return RecordFields.FINDABLE_STATE.equals(state());
    }

    /** Text value of a top-level source field, or null when absent. */
    public String text(String field) {
        JsonNode node = source.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
