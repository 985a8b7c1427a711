package org.finos.cubes.query;

import org.finos.cubes.browser.ComputedField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options of an aggregation request.
 *
 * Drill-down is active when row levels are given, or when {@link Builder#drillDown(String)}
 * asks for the level below the slice's point cut on the row dimension.
 */
public final class AggregationOptions {

    private final Set<Aggregation> aggregations;
    private final String rowDimension;
    private final List<String> rowLevels;
    private final boolean drillDown;
    private final String orderBy;
    private final String orderDirection;
    private final Integer page;
    private final Integer pageSize;
    private final RankLimit limit;
    private final Map<String, ComputedField> computedFields;

    private AggregationOptions(Builder builder) {
        this.aggregations = builder.aggregations.isEmpty()
                ? Collections.singleton(Aggregation.SUM)
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.aggregations));
        this.rowDimension = builder.rowDimension;
        this.rowLevels = builder.rowLevels == null ? null : List.copyOf(builder.rowLevels);
        this.drillDown = builder.drillDown;
        this.orderBy = builder.orderBy;
        this.orderDirection = builder.orderDirection;
        this.page = builder.page;
        this.pageSize = builder.pageSize;
        this.limit = builder.limit;
        this.computedFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.computedFields));
    }

    public static AggregationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The requested operators in request order, {@code {sum}} when none was given
     */
    public Set<Aggregation> aggregations() {
        return aggregations;
    }

    public String rowDimension() {
        return rowDimension;
    }

    /**
     * @return Explicit row level names, or null
     */
    public List<String> rowLevels() {
        return rowLevels;
    }

    /**
     * @return Whether row levels are derived from the slice's cut on the row dimension
     */
    public boolean drillDown() {
        return drillDown;
    }

    public boolean isDrillDown() {
        return rowLevels != null || drillDown;
    }

    public String orderBy() {
        return orderBy;
    }

    public String orderDirection() {
        return orderDirection;
    }

    public Integer page() {
        return page;
    }

    public Integer pageSize() {
        return pageSize;
    }

    public RankLimit limit() {
        return limit;
    }

    public Map<String, ComputedField> computedFields() {
        return computedFields;
    }

    @Override
    public String toString() {
        return "AggregationOptions(aggregations=" + aggregations
                + ", rowDimension=" + rowDimension
                + ", rowLevels=" + rowLevels
                + ", drillDown=" + drillDown
                + ", orderBy=" + orderBy + " " + orderDirection
                + ", page=" + page + "/" + pageSize
                + ", limit=" + limit
                + ", computedFields=" + computedFields.keySet() + ")";
    }

    public static final class Builder {
        private final Set<Aggregation> aggregations = new LinkedHashSet<>();
        private String rowDimension;
        private List<String> rowLevels;
        private boolean drillDown;
        private String orderBy;
        private String orderDirection;
        private Integer page;
        private Integer pageSize;
        private RankLimit limit;
        private final Map<String, ComputedField> computedFields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder aggregations(Aggregation... operators) {
            Collections.addAll(aggregations, operators);
            return this;
        }

        /**
         * @throws org.finos.cubes.ConfigurationException for an unknown operator name
         */
        public Builder aggregations(String... operatorNames) {
            for (String operatorName : operatorNames) {
                aggregations.add(Aggregation.fromName(operatorName));
            }
            return this;
        }

        /**
         * Drills down into explicitly named levels of a dimension.
         */
        public Builder rowLevels(String dimension, String... levels) {
            this.rowDimension = dimension;
            this.rowLevels = new ArrayList<>(List.of(levels));
            return this;
        }

        public Builder rowLevels(String dimension, List<String> levels) {
            this.rowDimension = dimension;
            this.rowLevels = new ArrayList<>(levels);
            return this;
        }

        /**
         * Drills down one level below the slice's point cut on the dimension,
         * or into its first level when the slice does not cut it.
         */
        public Builder drillDown(String dimension) {
            this.rowDimension = dimension;
            this.drillDown = true;
            return this;
        }

        public Builder orderBy(String field, String direction) {
            this.orderBy = field;
            this.orderDirection = direction;
            return this;
        }

        public Builder orderBy(String field) {
            this.orderBy = field;
            return this;
        }

        public Builder orderDirection(String direction) {
            this.orderDirection = direction;
            return this;
        }

        public Builder page(int page, int pageSize) {
            this.page = page;
            this.pageSize = pageSize;
            return this;
        }

        public Builder page(Integer page) {
            this.page = page;
            return this;
        }

        public Builder pageSize(Integer pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder limit(RankLimit rankLimit) {
            this.limit = rankLimit;
            return this;
        }

        public Builder computedField(String field, ComputedField computation) {
            computedFields.put(field, computation);
            return this;
        }

        public AggregationOptions build() {
            return new AggregationOptions(this);
        }
    }
}
