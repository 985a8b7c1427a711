package org.finos.cubes.browser;

import org.finos.cubes.cut.Cut;
import org.finos.cubes.execution.Row;
import org.finos.cubes.model.Cube;
import org.finos.cubes.model.Path;
import org.finos.cubes.query.AggregationOptions;
import org.finos.cubes.query.FactQueryOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A cube bound to an ordered set of cuts.
 *
 * {@code cutBy*} return a new slice and leave this one untouched.
 * {@link #addCut(Cut)} and {@link #removeCutsByDimension(String)} change this
 * slice in place and drop its cached summaries. A slice is not thread-safe.
 */
public final class Slice {

    private final AggregationBrowser browser;
    private final List<Cut> cuts;
    private final SummaryCache summaryCache = new SummaryCache();

    Slice(AggregationBrowser browser, List<Cut> cuts) {
        this.browser = Objects.requireNonNull(browser, "Browser cannot be null");
        this.cuts = new ArrayList<>(cuts);
    }

    public AggregationBrowser browser() {
        return browser;
    }

    public Cube cube() {
        return browser.cube();
    }

    public List<Cut> cuts() {
        return List.copyOf(cuts);
    }

    public List<Cut> cutsForDimension(String dimension) {
        return cuts.stream().filter(c -> c.dimension().equals(dimension)).toList();
    }

    SummaryCache summaryCache() {
        return summaryCache;
    }

    // ==================== Copy-on-write ====================

    public Slice cutBy(Cut cut) {
        Objects.requireNonNull(cut, "Cut cannot be null");
        List<Cut> copy = new ArrayList<>(cuts);
        copy.add(cut);
        return new Slice(browser, copy);
    }

    public Slice cutByPoint(String dimension, Object... path) {
        return cutBy(Cut.point(dimension, path));
    }

    public Slice cutByPoint(String dimension, Path path) {
        return cutBy(Cut.point(dimension, path));
    }

    public Slice cutByRange(String dimension, Object fromKey, Object toKey) {
        return cutBy(Cut.range(dimension, fromKey, toKey));
    }

    // ==================== In place ====================

    public Slice addCut(Cut cut) {
        Objects.requireNonNull(cut, "Cut cannot be null");
        cuts.add(cut);
        summaryCache.clear();
        return this;
    }

    public Slice removeCutsByDimension(String dimension) {
        if (cuts.removeIf(c -> c.dimension().equals(dimension))) {
            summaryCache.clear();
        }
        return this;
    }

    // ==================== Queries ====================

    public AggregationResult aggregate(String measure) {
        return browser.aggregate(this, measure, AggregationOptions.defaults());
    }

    public AggregationResult aggregate(String measure, AggregationOptions options) {
        return browser.aggregate(this, measure, options);
    }

    public List<Row> facts() {
        return browser.facts(this, FactQueryOptions.none());
    }

    public List<Row> facts(FactQueryOptions options) {
        return browser.facts(this, options);
    }

    public Optional<Row> fact(Object id) {
        return browser.fact(id);
    }

    public List<Row> dimensionValues(String dimension, Path path) {
        return browser.dimensionValues(this, dimension, path, FactQueryOptions.none());
    }

    public List<Row> dimensionValues(String dimension, Path path, FactQueryOptions options) {
        return browser.dimensionValues(this, dimension, path, options);
    }

    public Optional<Row> dimensionDetail(String dimension, Path path) {
        return browser.dimensionDetail(this, dimension, path);
    }

    @Override
    public String toString() {
        return "Slice(" + browser.cube().name() + " " + cuts + ")";
    }
}
