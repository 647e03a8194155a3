package org.opensearch.export.pipeline.serializer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.opensearch.export.source.RecordFields;
import org.opensearch.export.source.SearchRecord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes a DOI record the way the public REST API renders it:
 * {@code {id, type: "dois", attributes, relationships}}.
 *
 * <p>Relationship ids are lifted out of the indexed document into {@code relationships}, a few
 * index-only field names are mapped back to their API names, keys are camel-cased at every depth
 * and the derived attributes ({@code published}, {@code alternateIdentifiers}) are filled in.</p>
 */
public class DoiRecordSerializer implements RecordSerializer {
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private static final Map<String, String> RENAMED_FIELDS = Map.of(
        "uid", "doi",
        "publisher_obj", "publisher",
        "version_info", "version",
        "aasm_state", "state"
    );
    // Applied in this order so the output key order is stable
    private static final List<String> RENAME_ORDER = List.of("uid", "publisher_obj", "version_info", "aasm_state");

    private static final List<String> ARRAY_FIELDS = List.of(
        "creators", "contributors", "rightsList", "fundingReferences", "identifiers",
        "relatedIdentifiers", "relatedItems", "geoLocations", "dates", "subjects",
        "sizes", "titles", "descriptions", "formats");
    private static final List<String> OBJECT_FIELDS = List.of("container", "types");
    private static final Set<String> ISSUED_DATE_TYPES = Set.of("Issued", "issued");

    /** Relationship name in the output, to the indexed field holding its ids. */
    private static final List<Map.Entry<String, String>> TO_MANY_RELATIONSHIPS = List.of(
        Map.entry("media", "media_ids"),
        Map.entry("references", "reference_ids"),
        Map.entry("citations", "citation_ids"),
        Map.entry("parts", "part_ids"),
        Map.entry("partOf", "part_of_ids"),
        Map.entry("versions", "version_ids"),
        Map.entry("versionOf", "version_of_ids")
    );

    /** Allow-listed fields that always appear in the attributes, null when the index has no value. */
    private static final List<String> ATTRIBUTE_FIELDS = attributeFields();

    private final ObjectMapper objectMapper;

    public DoiRecordSerializer() {
        this(new ObjectMapper());
    }

    public DoiRecordSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ObjectNode serialize(SearchRecord record) {
        var attributes = record.source().deepCopy();

        var clientId = attributes.remove("client_id");
        var providerId = attributes.remove("provider_id");
        List<ArrayNode> relationshipIds = new ArrayList<>();
        for (var relationship : TO_MANY_RELATIONSHIPS) {
            relationshipIds.add(asArray(attributes.remove(relationship.getValue())));
        }

        for (String indexName : RENAME_ORDER) {
            var value = attributes.remove(indexName);
            attributes.set(RENAMED_FIELDS.get(indexName), value == null ? nodes.nullNode() : value);
        }

        attributes = (ObjectNode) camelize(attributes);
        populateMissingFields(attributes);
        wrapArrayFields(attributes);
        populateEmptyObjects(attributes);
        populatePublished(attributes);
        populateIdentifiers(attributes);
        convertIsActive(attributes);

        var result = objectMapper.createObjectNode();
        result.set("id", attributes.get("doi"));
        result.put("type", "dois");
        result.set("attributes", attributes);
        var relationships = result.putObject("relationships");
        relationships.set("client", toOne(clientId, "clients"));
        relationships.set("provider", toOne(providerId, "providers"));
        for (int i = 0; i < TO_MANY_RELATIONSHIPS.size(); i++) {
            relationships.set(TO_MANY_RELATIONSHIPS.get(i).getKey(), toMany(relationshipIds.get(i)));
        }
        return result;
    }

    /** snake_case to camelCase on every object key, recursing through objects and arrays. */
    static JsonNode camelize(JsonNode node) {
        if (node.isObject()) {
            var camelized = nodes.objectNode();
            node.fields().forEachRemaining(e -> camelized.set(camelize(e.getKey()), camelize(e.getValue())));
            return camelized;
        }
        if (node.isArray()) {
            var camelized = nodes.arrayNode();
            node.forEach(element -> camelized.add(camelize(element)));
            return camelized;
        }
        return node;
    }

    static String camelize(String key) {
        // Leading underscores are kept as they are
        int start = 0;
        while (start < key.length() && key.charAt(start) == '_') {
            start++;
        }
        var out = new StringBuilder(key.substring(0, start));
        boolean upperNext = false;
        for (int i = start; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                out.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static List<String> attributeFields() {
        Set<String> excluded = new HashSet<>(RENAMED_FIELDS.keySet());
        excluded.add("client_id");
        excluded.add("provider_id");
        TO_MANY_RELATIONSHIPS.forEach(relationship -> excluded.add(relationship.getValue()));
        List<String> fields = new ArrayList<>();
        for (String field : RecordFields.EXPORTED_FIELDS) {
            if (!excluded.contains(field)) {
                fields.add(camelize(field));
            }
        }
        return List.copyOf(fields);
    }

    private static void populateMissingFields(ObjectNode attributes) {
        for (String field : ATTRIBUTE_FIELDS) {
            if (!attributes.has(field)) {
                attributes.putNull(field);
            }
        }
    }

    private static void wrapArrayFields(ObjectNode attributes) {
        for (String field : ARRAY_FIELDS) {
            var value = attributes.get(field);
            if (value == null || value.isNull()) {
                attributes.putArray(field);
            } else if (!value.isArray()) {
                var wrapped = attributes.putArray(field);
                if (isTruthy(value)) {
                    wrapped.add(value);
                }
            }
        }
    }

    private static void populateEmptyObjects(ObjectNode attributes) {
        for (String field : OBJECT_FIELDS) {
            if (!isTruthy(attributes.get(field))) {
                attributes.putObject(field);
            }
        }
    }

    private static void populatePublished(ObjectNode attributes) {
        String published = null;
        for (JsonNode date : attributes.path("dates")) {
            if (ISSUED_DATE_TYPES.contains(date.path("dateType").asText(null))) {
                var value = date.get("date");
                published = value == null || value.isNull() ? null : value.asText();
                break;
            }
        }
        var publicationYear = attributes.get("publicationYear");
        if (published == null || published.isEmpty()) {
            published = isTruthy(publicationYear) ? publicationYear.asText() : null;
        }
        attributes.put("published", published);
    }

    private static void populateIdentifiers(ObjectNode attributes) {
        var doi = attributes.path("doi").asText(null);
        var url = attributes.path("url").asText(null);
        var identifiers = nodes.arrayNode();
        var alternateIdentifiers = nodes.arrayNode();
        for (JsonNode identifier : attributes.path("identifiers")) {
            var value = identifier.path("identifier").asText(null);
            if (value != null && (value.equals(doi) || value.equals(url))) {
                continue;
            }
            identifiers.add(identifier);
            var alternate = alternateIdentifiers.addObject();
            alternate.set("alternateIdentifierType", nullToNode(identifier.get("identifierType")));
            alternate.set("alternateIdentifier", nullToNode(identifier.get("identifier")));
        }
        attributes.set("identifiers", identifiers);
        attributes.set("alternateIdentifiers", alternateIdentifiers);
    }

    /** The index stores the flag as a one-character string whose code is 1 when active. */
    private static void convertIsActive(ObjectNode attributes) {
        var value = attributes.get("isActive");
        boolean active;
        if (value == null || value.isNull()) {
            active = false;
        } else if (value.isBoolean()) {
            active = value.booleanValue();
        } else if (value.isNumber()) {
            active = value.asInt() == 1;
        } else {
            var text = value.asText();
            active = !text.isEmpty() && text.charAt(0) == 1;
        }
        attributes.put("isActive", active);
    }

    private static ObjectNode toOne(JsonNode id, String type) {
        var relationship = nodes.objectNode();
        var data = relationship.putObject("data");
        data.set("id", nullToNode(id));
        data.put("type", type);
        return relationship;
    }

    private static ObjectNode toMany(ArrayNode ids) {
        var relationship = nodes.objectNode();
        var data = relationship.putArray("data");
        for (JsonNode id : ids) {
            data.addObject().<ObjectNode>set("id", id).put("type", "dois");
        }
        return relationship;
    }

    private static ArrayNode asArray(JsonNode node) {
        if (node instanceof ArrayNode) {
            return (ArrayNode) node;
        }
        var array = nodes.arrayNode();
        if (isTruthy(node)) {
            array.add(node);
        }
        return array;
    }

    private static JsonNode nullToNode(JsonNode node) {
        return node == null ? nodes.nullNode() : node;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.asDouble() != 0;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        return node.size() > 0;
    }
}
