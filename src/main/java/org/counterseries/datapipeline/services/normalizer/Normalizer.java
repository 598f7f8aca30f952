package org.counterseries.datapipeline.services.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.GroupKey;
import org.counterseries.datapipeline.api.contracts.NormalizationResult;
import org.counterseries.datapipeline.api.contracts.RawRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns untrusted raw snapshots into canonical, deduplicated records ordered by
 * (source, item, timestamp).
 * <p>
 * Processing steps:
 * <ol>
 *   <li>Field coercion: descriptive fields become strings (missing values become {@code ""}),
 *       counters become numbers or absent. A bad field never fails the record.</li>
 *   <li>Timestamp construction from {@code date} + {@code hour} + {@code minute}, or from a
 *       combined {@code timestamp} field when {@code date} is missing.</li>
 *   <li>Dedup on (source, item, timestamp): the last record in input order wins. All records of a
 *       series without a valid timestamp share one key.</li>
 *   <li>Records without a valid timestamp are dropped after dedup.</li>
 *   <li>Stable sort by (source, item, timestamp).</li>
 * </ol>
 */
public class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    public static final String SOURCE_FIELD = "source";
    public static final String ITEM_ID_FIELD = "item_id";
    public static final String DATE_FIELD = "date";
    public static final String HOUR_FIELD = "hour";
    public static final String MINUTE_FIELD = "minute";
    public static final String TIMESTAMP_FIELD = "timestamp";

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter COMBINED_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd[ ]['T']HH:mm[:ss[.SSS]]").withResolverStyle(ResolverStyle.STRICT);

    private static final Comparator<Candidate> CANONICAL_ORDER = Comparator
            .comparing(Candidate::source)
            .thenComparing(Candidate::itemId)
            .thenComparing(Candidate::timestamp)
            .thenComparingInt(Candidate::position);

    private final PipelineConfig config;

    public Normalizer(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param rawRecords snapshots in input order; later records take precedence on dedup-key collisions
     * @return canonical records with collision and rejection counts
     */
    public NormalizationResult normalize(List<RawRecord> rawRecords) {
        Objects.requireNonNull(rawRecords, "rawRecords");
        if (rawRecords.isEmpty()) {
            return NormalizationResult.empty();
        }

        final Map<DedupKey, Candidate> winners = new HashMap<>();
        int collisions = 0;
        int position = 0;
        for (RawRecord raw : rawRecords) {
            final Candidate candidate = coerce(raw, position++);
            if (winners.put(candidate.dedupKey(), candidate) != null) {
                collisions++;
            }
        }
        if (collisions > 0) {
            log.info("Found {} duplicate-key records, keeping the last record for each key", collisions);
        }

        final List<Candidate> valid = new ArrayList<>(winners.size());
        int rejected = 0;
        for (Candidate candidate : winners.values()) {
            if (candidate.timestamp() == null) {
                rejected++;
                log.debug("Dropping record {} without a valid timestamp", candidate.groupKey());
            } else {
                valid.add(candidate);
            }
        }
        if (rejected > 0) {
            log.warn("Dropped {} records whose timestamp could not be parsed", rejected);
        }

        valid.sort(CANONICAL_ORDER);
        final List<CanonicalRecord> records = new ArrayList<>(valid.size());
        for (Candidate candidate : valid) {
            records.add(new CanonicalRecord(candidate.source(), candidate.itemId(), candidate.timestamp(),
                    candidate.descriptive(), candidate.counters()));
        }

        log.debug("Normalized {} raw records into {} canonical records", rawRecords.size(), records.size());
        return new NormalizationResult(records, collisions, rejected);
    }

    private Candidate coerce(RawRecord raw, int position) {
        final Map<String, String> descriptive = new LinkedHashMap<>();
        for (String field : config.descriptiveFields()) {
            descriptive.put(field, asText(lookup(raw, field)));
        }

        final Map<String, Double> counters = new LinkedHashMap<>();
        for (CounterField counter : config.counters()) {
            counters.put(counter.name(), asNumber(lookup(raw, counter.name())));
        }

        return new Candidate(
                asText(lookup(raw, SOURCE_FIELD)),
                asText(lookup(raw, ITEM_ID_FIELD)),
                buildTimestamp(raw),
                descriptive,
                counters,
                position);
    }

    /**
     * Resolves a canonical field, falling back to any configured alias when the canonical name is missing.
     */
    private JsonNode lookup(RawRecord raw, String field) {
        final JsonNode direct = raw.get(field);
        if (direct != null) {
            return direct;
        }
        for (Map.Entry<String, String> alias : config.fieldAliases().entrySet()) {
            if (alias.getValue().equals(field)) {
                final JsonNode aliased = raw.get(alias.getKey());
                if (aliased != null) {
                    return aliased;
                }
            }
        }
        return null;
    }

    private LocalDateTime buildTimestamp(RawRecord raw) {
        final JsonNode date = lookup(raw, DATE_FIELD);
        if (date == null) {
            return parseCombined(lookup(raw, TIMESTAMP_FIELD));
        }
        if (!date.isTextual()) {
            return null;
        }

        final Long hour = asWholeNumber(lookup(raw, HOUR_FIELD));
        final Long minute = asWholeNumber(lookup(raw, MINUTE_FIELD));
        final long h = hour == null ? 0 : hour;
        final long m = minute == null ? 0 : minute;
        if (h < 0 || h > 23 || m < 0 || m > 59) {
            return null;
        }

        try {
            final LocalDate day = LocalDate.parse(date.textValue().trim(), DATE_FORMAT);
            return LocalDateTime.of(day, LocalTime.of((int) h, (int) m));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime parseCombined(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.textValue().trim(), COMBINED_FORMAT).truncatedTo(ChronoUnit.MINUTES);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String asText(JsonNode value) {
        if (value == null) {
            return "";
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    /**
     * @return the numeric value, or {@code null} for anything that is not a finite number
     */
    static Double asNumber(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            final double number = value.doubleValue();
            return Double.isFinite(number) ? number : null;
        }
        if (value.isTextual()) {
            final String text = value.textValue().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                final double number = new BigDecimal(text).doubleValue();
                return Double.isFinite(number) ? number : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Hour and minute parsing: numbers are truncated toward zero, non-numeric values count as missing.
     */
    private static Long asWholeNumber(JsonNode value) {
        final Double number = asNumber(value);
        if (number == null) {
            return null;
        }
        return (long) number.doubleValue();
    }

    /**
     * @param timestamp {@code null} for every record without a valid timestamp
     */
    private record DedupKey(GroupKey series, LocalDateTime timestamp) {
    }

    private record Candidate(
            String source,
            String itemId,
            LocalDateTime timestamp,
            Map<String, String> descriptive,
            Map<String, Double> counters,
            int position
    ) {
        DedupKey dedupKey() {
            return new DedupKey(groupKey(), timestamp);
        }

        GroupKey groupKey() {
            return new GroupKey(source, itemId);
        }
    }
}
