package org.counterseries.datapipeline.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Assigns distinct file name stems to keys whose sanitized names may coincide.
 * <p>
 * Keys are processed in iteration order: the first key keeps its stem, every later key with an
 * already used stem gets a numeric suffix ({@code _2}, {@code _3}, ...).
 */
public final class UniqueFileNames {

    private static final Logger log = LoggerFactory.getLogger(UniqueFileNames.class);

    private UniqueFileNames() {
        // Utility class - prevent instantiation
    }

    /**
     * @param keys  keys in a deterministic order
     * @param stem  the sanitized file name stem of a key
     * @return a distinct stem per key, in the order of {@code keys}
     */
    public static <K> Map<K, String> assign(Collection<K> keys, Function<K, String> stem) {
        final Map<K, String> assigned = new LinkedHashMap<>();
        final Set<String> used = new HashSet<>();
        for (K key : keys) {
            if (assigned.containsKey(key)) {
                continue;
            }
            final String base = stem.apply(key);
            String candidate = base;
            for (int suffix = 2; !used.add(candidate); suffix++) {
                candidate = base + "_" + suffix;
            }
            if (!candidate.equals(base)) {
                log.warn("File name '{}' is already taken, writing {} as '{}'", base, key, candidate);
            }
            assigned.put(key, candidate);
        }
        return assigned;
    }
}
