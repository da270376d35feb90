package com.tabletop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Prices of generated properties, bound from {@code engine.property}.
 * Property {@code i} costs {@code basePrice + i * priceStep} and rents for {@code price / rentDivisor}.
 */
@ConfigurationProperties(prefix = "engine.property")
public record PropertyPricingProperties(int basePrice, int priceStep, int rentDivisor) {

    public PropertyPricingProperties {
        if (basePrice <= 0) {
            basePrice = 100;
        }
        if (priceStep < 0) {
            priceStep = 50;
        }
        if (rentDivisor <= 0) {
            rentDivisor = 10;
        }
    }

    public static PropertyPricingProperties defaults() {
        return new PropertyPricingProperties(100, 50, 10);
    }

    public int priceOf(int index) {
        return basePrice + index * priceStep;
    }

    public int rentFor(int price) {
        return price / rentDivisor;
    }
}
