package com.example.storefront.domain.service;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One (unit price, quantity) pair fed to the pricing engine
 */
@Value(staticConstructor = "of")
public class PricedLine {
    BigDecimal unitPrice;
    int quantity;
}
