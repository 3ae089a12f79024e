package com.kbindex.index;

import java.time.Instant;

public record IndexEntry(long id, Instant updatedAt) {

    /** True when the record was updated at or after {@code sourceModified}; ties count as current. */
    public boolean isCurrentAsOf(Instant sourceModified) {
        return updatedAt != null && sourceModified != null && !updatedAt.isBefore(sourceModified);
    }
}
