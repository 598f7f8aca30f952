package org.counterseries.testutils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.RawRecord;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for records used across the pipeline tests.
 */
public final class TestRecords {

    public static final String PLAYS = "total_plays";
    public static final String LISTENERS = "total_listeners";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestRecords() {
    }

    /**
     * Parses a JSON object literal, e.g. {@code raw("{\"source\":\"s\"}")}.
     */
    public static RawRecord raw(String json) {
        try {
            return RawRecord.fromJson((ObjectNode) MAPPER.readTree(json));
        } catch (Exception e) {
            throw new IllegalArgumentException("Bad test JSON: " + json, e);
        }
    }

    /**
     * A raw snapshot in the date/hour/minute layout with a plays counter only.
     */
    public static RawRecord snapshot(String source, String itemId, String date, int hour, int minute, Double plays) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("source", source);
        node.put("item_id", itemId);
        node.put("date", date);
        node.put("hour", hour);
        node.put("minute", minute);
        if (plays == null) {
            node.putNull(PLAYS);
        } else {
            node.put(PLAYS, plays);
        }
        return RawRecord.fromJson(node);
    }

    public static CanonicalRecord canonical(String source, String itemId, String timestamp, Double plays, Double listeners) {
        final Map<String, Double> counters = new LinkedHashMap<>();
        counters.put(PLAYS, plays);
        counters.put(LISTENERS, listeners);
        final Map<String, String> descriptive = new LinkedHashMap<>();
        descriptive.put("item_name", "Song " + itemId);
        descriptive.put("artist_name", "Artist");
        descriptive.put("collection_name", "");
        return new CanonicalRecord(source, itemId, at(timestamp), descriptive, counters);
    }

    /**
     * @param timestamp {@code yyyy-MM-ddTHH:mm}
     */
    public static LocalDateTime at(String timestamp) {
        return LocalDateTime.parse(timestamp);
    }
}
