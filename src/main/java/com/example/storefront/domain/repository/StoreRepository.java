package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.common.RecordState;
import com.example.storefront.domain.model.store.Store;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Store lookups. Soft-deleted rows are filtered by the caller passing the record state.
 */
@Repository
public interface StoreRepository extends JpaRepository<Store, String> {

    Optional<Store> findByUsername(String username);

    Optional<Store> findByIdAndRecordState(String id, RecordState recordState);
}
