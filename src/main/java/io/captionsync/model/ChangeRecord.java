package io.captionsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One column-level delta. {@code pk} is the JSON array of the row's primary-key values;
 * {@code cid} is the column name, or {@link #ROW_SENTINEL} for row existence (val 1 alive, 0 deleted).
 */
public record ChangeRecord(
        @JsonProperty("table") String table,
        @JsonProperty("pk") String pk,
        @JsonProperty("cid") String cid,
        @JsonProperty("val") Object val,
        @JsonProperty("col_version") long colVersion,
        @JsonProperty("db_version") long dbVersion,
        @JsonProperty("site_id") String siteId,
        @JsonProperty("seq") int seq
) {
    public static final String ROW_SENTINEL = "-1";

    public boolean isRowSentinel() {
        return ROW_SENTINEL.equals(cid);
    }
}
