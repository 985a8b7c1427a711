package org.finos.cubes.query;

/**
 * Ordering and pagination of fact and dimension value listings.
 *
 * @param orderBy        Field to order by; null for the default order
 * @param orderDirection asc, ascending, desc or descending; null for ascending
 * @param page           Zero-based page; null for all rows
 * @param pageSize       Rows per page
 */
public record FactQueryOptions(
        String orderBy,
        String orderDirection,
        Integer page,
        Integer pageSize) {

    public static FactQueryOptions none() {
        return new FactQueryOptions(null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String orderBy;
        private String orderDirection;
        private Integer page;
        private Integer pageSize;

        private Builder() {
        }

        public Builder orderBy(String field) {
            this.orderBy = field;
            return this;
        }

        public Builder orderBy(String field, String direction) {
            this.orderBy = field;
            this.orderDirection = direction;
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

        public FactQueryOptions build() {
            return new FactQueryOptions(orderBy, orderDirection, page, pageSize);
        }
    }
}
