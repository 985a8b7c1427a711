package org.finos.cubes.browser;

import org.finos.cubes.cut.Cut;
import org.finos.cubes.query.Aggregation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Summaries already computed for a slice.
 *
 * Entries are keyed by the cuts they were computed for, the measure and the
 * selected aggregations. The owning slice clears the cache whenever its cuts
 * change.
 */
public final class SummaryCache {

    /**
     * @param cuts         The cuts in effect
     * @param measure      The measure; null for record count only
     * @param aggregations The selected operators
     */
    public record SummaryKey(List<Cut> cuts, String measure, Set<Aggregation> aggregations) {
        public SummaryKey {
            cuts = List.copyOf(cuts);
            aggregations = Set.copyOf(aggregations);
        }
    }

    private final Map<SummaryKey, Summary> entries = new HashMap<>();

    public Optional<Summary> find(SummaryKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void put(SummaryKey key, Summary summary) {
        entries.put(key, summary);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
