package org.counterseries.datapipeline.api.contracts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One observation exactly as received from ingestion. Nothing about its fields is trusted.
 *
 * @param fields raw field values keyed by field name
 */
public record RawRecord(Map<String, JsonNode> fields) {

    public RawRecord {
        Objects.requireNonNull(fields, "fields");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * @param object a parsed JSON object
     * @return a record holding the object's top-level fields
     */
    public static RawRecord fromJson(ObjectNode object) {
        final Map<String, JsonNode> fields = new LinkedHashMap<>();
        object.fields().forEachRemaining(entry -> fields.put(entry.getKey(), entry.getValue()));
        return new RawRecord(fields);
    }

    /**
     * @param field field name
     * @return the raw value, or {@code null} if the field is missing or JSON null
     */
    public JsonNode get(String field) {
        final JsonNode node = fields.get(field);
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }
}
