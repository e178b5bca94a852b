package com.example.storefront.domain.model.store;

import com.example.storefront.domain.model.common.BaseEntity;
import com.example.storefront.domain.model.common.RecordState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Store entity. Owned by the store module; this service only reads it for
 * public lookup by username and owner checks.
 */
@Entity
@Table(name = "stores", indexes = {
        @Index(name = "idx_store_user", columnList = "user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Store extends BaseEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_state", nullable = false, length = 10)
    @Builder.Default
    private RecordState recordState = RecordState.ACTIVE;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    /**
     * Open for checkout: active and not soft-deleted
     */
    public boolean isOpen() {
        return active && !recordState.isDeleted();
    }

    public boolean isOwnedBy(String requesterUserId) {
        return userId != null && userId.equals(requesterUserId);
    }
}
