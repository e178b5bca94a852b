package com.example.storefront.infrastructure.gateway;

import com.example.storefront.application.dto.BankInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bank codes accepted for payouts, loaded once from {@code banks/nigerian-banks.json}.
 */
@Component
@Slf4j
public class BankDirectory {

    static final String BANKS_RESOURCE = "banks/nigerian-banks.json";
    public static final String UNKNOWN_BANK = "Unknown Bank";

    private final List<BankInfo> banks;
    private final Map<String, BankInfo> byCode;

    public BankDirectory(ObjectMapper objectMapper) {
        this.banks = Collections.unmodifiableList(load(objectMapper, BANKS_RESOURCE));

        Map<String, BankInfo> index = new LinkedHashMap<>();
        for (BankInfo bank : banks) {
            index.putIfAbsent(bank.getCode(), bank);
        }
        this.byCode = Collections.unmodifiableMap(index);
        log.info("Bank directory loaded: {} banks", banks.size());
    }

    public List<BankInfo> getBanks() {
        return banks;
    }

    public Optional<BankInfo> findByCode(String code) {
        return Optional.ofNullable(code).map(byCode::get);
    }

    public String nameOf(String code) {
        return findByCode(code).map(BankInfo::getName).orElse(UNKNOWN_BANK);
    }

    private static List<BankInfo> load(ObjectMapper objectMapper, String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<BankInfo>>() { });
        } catch (Exception e) {
            log.error("Error loading bank list from {}: {}", path, e.getMessage(), e);
            throw new IllegalStateException("Failed to load bank list: " + path, e);
        }
    }
}
