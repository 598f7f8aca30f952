package org.counterseries.datapipeline.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.services.aggregation.NetChangePolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of the {@code pipeline} and {@code aggregation} configuration sections.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * pipeline {
 *   counters = ["total_plays", "total_listeners"]
 *   descriptive-fields = ["item_name", "artist_name", "collection_name"]
 *   field-aliases { platform = source, song_id = item_id }
 *   parallelism = 1
 * }
 * aggregation.net-change-policy = ABSENT
 * </pre>
 */
public record PipelineConfig(
        List<CounterField> counters,
        List<String> descriptiveFields,
        Map<String, String> fieldAliases,
        int parallelism,
        NetChangePolicy netChangePolicy
) {

    private static final String PIPELINE_PATH = "pipeline";
    private static final String COUNTERS_KEY = "counters";
    private static final String DESCRIPTIVE_FIELDS_KEY = "descriptive-fields";
    private static final String FIELD_ALIASES_KEY = "field-aliases";
    private static final String PARALLELISM_KEY = "parallelism";
    private static final String NET_CHANGE_POLICY_PATH = "aggregation.net-change-policy";

    public PipelineConfig {
        Objects.requireNonNull(netChangePolicy, "netChangePolicy");
        counters = List.copyOf(counters);
        descriptiveFields = List.copyOf(descriptiveFields);
        fieldAliases = Collections.unmodifiableMap(new LinkedHashMap<>(fieldAliases));
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
    }

    /**
     * Reads the pipeline settings, falling back to the classpath defaults for anything missing.
     *
     * @param config application configuration
     * @return the parsed settings
     * @throws ConfigException if a value has the wrong type or an unknown policy name
     */
    public static PipelineConfig fromConfig(Config config) {
        final Config merged = config.withFallback(ConfigFactory.defaultReference());
        final Config pipeline = merged.getConfig(PIPELINE_PATH);

        final List<CounterField> counters = new ArrayList<>();
        for (String name : pipeline.getStringList(COUNTERS_KEY)) {
            counters.add(CounterField.of(name));
        }

        final Map<String, String> aliases = new LinkedHashMap<>();
        if (pipeline.hasPath(FIELD_ALIASES_KEY)) {
            for (Map.Entry<String, ConfigValue> entry : pipeline.getConfig(FIELD_ALIASES_KEY).root().entrySet()) {
                aliases.put(entry.getKey(), entry.getValue().unwrapped().toString());
            }
        }

        final int parallelism = pipeline.getInt(PARALLELISM_KEY);
        if (parallelism < 1) {
            throw new ConfigException.BadValue(PIPELINE_PATH + "." + PARALLELISM_KEY, "must be at least 1");
        }

        return new PipelineConfig(
                counters,
                pipeline.getStringList(DESCRIPTIVE_FIELDS_KEY),
                aliases,
                parallelism,
                merged.getEnum(NetChangePolicy.class, NET_CHANGE_POLICY_PATH));
    }

    /**
     * @return the settings from {@code reference.conf} alone
     */
    public static PipelineConfig defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    public PipelineConfig withParallelism(int threads) {
        return new PipelineConfig(counters, descriptiveFields, fieldAliases, threads, netChangePolicy);
    }

    public PipelineConfig withNetChangePolicy(NetChangePolicy policy) {
        return new PipelineConfig(counters, descriptiveFields, fieldAliases, parallelism, policy);
    }
}
