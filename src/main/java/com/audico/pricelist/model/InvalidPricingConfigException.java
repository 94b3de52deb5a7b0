package com.audico.pricelist.model;

/**
 * Raised when a {@link PricingConfig} is built with values no batch can be priced with.
 * Thrown at construction time so a batch never starts with a bad config.
 */
public class InvalidPricingConfigException extends IllegalArgumentException {
    public InvalidPricingConfigException(String message) {
        super(message);
    }
}
