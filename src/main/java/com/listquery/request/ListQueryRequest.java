package com.listquery.request;

/**
 * Raw list query parameters as received from the client. Missing parameters are empty strings.
 *
 * @param sort      sort parameter
 * @param filter    filter parameter
 * @param fields    fields parameter
 * @param nextToken next_token parameter
 * @param prevToken prev_token parameter
 * @param limit     limit parameter
 */
public record ListQueryRequest(
        String sort,
        String filter,
        String fields,
        String nextToken,
        String prevToken,
        String limit
) {
    public ListQueryRequest {
        sort = sort == null ? "" : sort;
        filter = filter == null ? "" : filter;
        fields = fields == null ? "" : fields;
        nextToken = nextToken == null ? "" : nextToken;
        prevToken = prevToken == null ? "" : prevToken;
        limit = limit == null ? "" : limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ListQueryRequest.
     */
    public static class Builder {
        private String sort;
        private String filter;
        private String fields;
        private String nextToken;
        private String prevToken;
        private String limit;

        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        public Builder filter(String filter) {
            this.filter = filter;
            return this;
        }

        public Builder fields(String fields) {
            this.fields = fields;
            return this;
        }

        public Builder nextToken(String nextToken) {
            this.nextToken = nextToken;
            return this;
        }

        public Builder prevToken(String prevToken) {
            this.prevToken = prevToken;
            return this;
        }

        public Builder limit(String limit) {
            this.limit = limit;
            return this;
        }

        public ListQueryRequest build() {
            return new ListQueryRequest(sort, filter, fields, nextToken, prevToken, limit);
        }
    }
}
