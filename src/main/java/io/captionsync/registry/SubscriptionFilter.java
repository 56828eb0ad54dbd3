package io.captionsync.registry;

import io.captionsync.model.ChangeRecord;

/**
 * Narrows remote change notifications. A null field matches anything.
 */
public record SubscriptionFilter(String table, String pk, String column) {

    public static SubscriptionFilter all() {
        return new SubscriptionFilter(null, null, null);
    }

    public static SubscriptionFilter table(String table) {
        return new SubscriptionFilter(table, null, null);
    }

    public static SubscriptionFilter row(String table, String pk) {
        return new SubscriptionFilter(table, pk, null);
    }

    public static SubscriptionFilter column(String table, String column) {
        return new SubscriptionFilter(table, null, column);
    }

    public boolean matches(ChangeRecord record) {
        if (table != null && !table.equals(record.table())) {
            return false;
        }
        if (pk != null && !pk.equals(record.pk())) {
            return false;
        }
        return column == null || column.equals(record.cid());
    }
}
