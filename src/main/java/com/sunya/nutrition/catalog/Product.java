package com.sunya.nutrition.catalog;

import java.util.List;

/** Storefront product. Owned by the shop; read-only here. */
public record Product(
        long id,
        String name,
        double nrsPrice,
        String description,
        List<String> features,
        String badge,
        Double pricePerGram
) {
    public Product {
        features = features == null ? List.of() : List.copyOf(features);
    }
}
