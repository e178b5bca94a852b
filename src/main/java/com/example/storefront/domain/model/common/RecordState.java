package com.example.storefront.domain.model.common;

/**
 * Soft-delete state of a row. Paired with a {@code deletedAt} column that is
 * non-null exactly when the state is {@link #DELETED}.
 */
public enum RecordState {
    ACTIVE,
    DELETED;

    public boolean isDeleted() {
        return this == DELETED;
    }
}
