package com.example.storefront.support;

import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.CheckoutCommand;
import com.example.storefront.application.dto.CustomerDetails;
import com.example.storefront.domain.model.catalog.Product;
import com.example.storefront.domain.model.common.RecordState;
import com.example.storefront.domain.model.store.Store;
import com.example.storefront.domain.repository.ProductRepository;
import com.example.storefront.domain.repository.StoreRepository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Test data for the integration tests. Every call creates fresh rows with
 * unique ids, so tests never need to clean up after each other.
 */
public class StorefrontFixtures {

    private final StoreRepository storeRepository;
    private final ProductRepository productRepository;

    public StorefrontFixtures(StoreRepository storeRepository, ProductRepository productRepository) {
        this.storeRepository = storeRepository;
        this.productRepository = productRepository;
    }

    public Store store(String usernamePrefix) {
        return storeRepository.save(Store.builder()
                .id(UUID.randomUUID().toString())
                .userId(UUID.randomUUID().toString())
                .username(usernamePrefix + "-" + shortId())
                .displayName(usernamePrefix)
                .active(true)
                .build());
    }

    public Product product(Store store, String name, String price, int stock) {
        return productRepository.save(Product.builder()
                .id(UUID.randomUUID().toString())
                .storeId(store.getId())
                .name(name)
                .price(new BigDecimal(price))
                .stockQuantity(stock)
                .imageUrl("https://cdn.example.com/" + name.toLowerCase().replace(' ', '-') + ".png")
                .active(true)
                .build());
    }

    public Product softDelete(Product product) {
        product.setRecordState(RecordState.DELETED);
        product.setDeletedAt(LocalDateTime.now());
        return productRepository.save(product);
    }

    public static CheckoutCommand.CheckoutCommandBuilder checkout(Store store) {
        return CheckoutCommand.builder()
                .storeUsername(store.getUsername())
                .customer(CustomerDetails.builder()
                        .name("Ada Obi")
                        .email("ada@example.com")
                        .phone("08012345678")
                        .deliveryAddress("12 Marina Road")
                        .deliveryState("Lagos")
                        .deliveryLga("Lagos Island")
                        .build());
    }

    public static ChannelProvisionResult channel(String accountNumber) {
        return ChannelProvisionResult.builder()
                .accountNumber(accountNumber)
                .accountName("STORE-Ada Obi")
                .bankName("Wema Bank")
                .expiresAt(LocalDateTime.now().plusHours(24))
                .build();
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
