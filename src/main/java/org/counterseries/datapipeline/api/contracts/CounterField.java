package org.counterseries.datapipeline.api.contracts;

import java.util.Objects;

/**
 * A cumulative counter tracked per (source, item) series.
 * <p>
 * {@code name} is the field read from input records (e.g. {@code total_plays}); {@code shortName}
 * is the stem used for derived columns (e.g. {@code delta_plays}, {@code rate_plays_per_min}).
 *
 * @param name      input field name
 * @param shortName stem for derived column names
 */
public record CounterField(String name, String shortName) {

    private static final String TOTAL_PREFIX = "total_";

    public CounterField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shortName, "shortName");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Counter name must not be blank");
        }
    }

    /**
     * Creates a counter whose short name strips a leading {@code total_} from the field name.
     *
     * @param name input field name
     * @return the counter definition
     */
    public static CounterField of(String name) {
        Objects.requireNonNull(name, "name");
        final String shortName = name.startsWith(TOTAL_PREFIX) && name.length() > TOTAL_PREFIX.length()
                ? name.substring(TOTAL_PREFIX.length())
                : name;
        return new CounterField(name, shortName);
    }

    public String deltaColumn() {
        return "delta_" + shortName;
    }

    public String rateColumn() {
        return "rate_" + shortName + "_per_min";
    }

    public String firstColumn() {
        return "first_" + name;
    }

    public String lastColumn() {
        return "last_" + name;
    }

    public String netColumn() {
        return "net_" + shortName;
    }

    public String avgRateColumn() {
        return "avg_rate_" + shortName + "_per_min";
    }
}
