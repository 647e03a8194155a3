package org.opensearch.export.source;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Names of the index fields the exporter reads, and the fixed projection applied to every record.
 */
public final class RecordFields {
    public static final String UID = "uid";
    public static final String STATE = "aasm_state";
    public static final String CLIENT_ID = "client_id";
    public static final String UPDATED = "updated";
    public static final String AGENCY = "agency";

    public static final String FINDABLE_STATE = "findable";

    public static final List<String> SORT_FIELDS = List.of(UPDATED, UID);

    public static final List<String> EXPORTED_FIELDS = List.of(
        "uid",
        "prefix",
        "suffix",
        "identifiers",
        "creators",
        "titles",
        "publisher_obj",
        "container",
        "publication_year",
        "subjects",
        "contributors",
        "dates",
        "language",
        "types",
        "related_identifiers",
        "related_items",
        "sizes",
        "formats",
        "version_info",
        "rights_list",
        "descriptions",
        "geo_locations",
        "funding_references",
        "url",
        "content_url",
        "metadata_version",
        "schema_version",
        "source",
        "is_active",
        "aasm_state",
        "reason",
        "view_count",
        "views_over_time",
        "download_count",
        "downloads_over_time",
        "reference_count",
        "citation_count",
        "citations_over_time",
        "part_count",
        "part_of_count",
        "version_count",
        "version_of_count",
        "created",
        "registered",
        "published",
        "updated",
        "client_id",
        "provider_id",
        "media_ids",
        "reference_ids",
        "citation_ids",
        "part_ids",
        "part_of_ids",
        "version_ids",
        "version_of_ids"
    );

    private static final Set<String> EXPORTED_FIELD_SET = Set.copyOf(EXPORTED_FIELDS);

    private RecordFields() {}

    /**
     * Removes every top-level field that is not on the allow-list. The node is modified in place
     * and returned.
     */
    public static ObjectNode project(ObjectNode source) {
        return project(source, EXPORTED_FIELD_SET);
    }

    public static ObjectNode project(ObjectNode source, Set<String> allowed) {
        Set<String> dropped = new HashSet<>();
        for (Iterator<String> names = source.fieldNames(); names.hasNext();) {
            var name = names.next();
            if (!allowed.contains(name)) {
                dropped.add(name);
            }
        }
        source.remove(dropped);
        return source;
    }
}
