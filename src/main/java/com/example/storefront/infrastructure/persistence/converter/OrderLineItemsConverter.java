package com.example.storefront.infrastructure.persistence.converter;

import com.example.storefront.domain.exception.InvalidLineItemException;
import com.example.storefront.domain.model.order.OrderLineItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;

/**
 * Stores order line items as a JSON array in a single column.
 * Every element is validated when read back; a malformed row fails loudly
 * instead of yielding a half-built order.
 */
@Slf4j
@Converter
public class OrderLineItemsConverter implements AttributeConverter<List<OrderLineItem>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

    private static final TypeReference<List<OrderLineItem>> ITEMS_TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<OrderLineItem> items) {
        if (items == null) {
            return "[]";
        }
        try {
            return MAPPER.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize order line items", e);
        }
    }

    @Override
    public List<OrderLineItem> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        List<OrderLineItem> items;
        try {
            items = MAPPER.readValue(json, ITEMS_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Stored order line items are not valid JSON: {}", e.getOriginalMessage());
            throw new InvalidLineItemException("Stored order line items are not valid JSON");
        }
        if (items == null) {
            return Collections.emptyList();
        }
        for (OrderLineItem item : items) {
            if (item == null) {
                throw new InvalidLineItemException("Stored order line items contain a null element");
            }
            item.validate();
        }
        return Collections.unmodifiableList(items);
    }
}
