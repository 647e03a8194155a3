package org.opensearch.export.pipeline.serializer;

import org.opensearch.export.source.SearchRecord;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Turns a search record into the JSON document written to the sequence files.
 * Implementations must be deterministic and accept any record the index returns.
 */
@FunctionalInterface
public interface RecordSerializer {
    ObjectNode serialize(SearchRecord record);
}
