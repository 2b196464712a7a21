package com.sunya.nutrition.acquisition.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunya.nutrition.model.NutritionMetadata;
import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;

import java.time.Instant;
import java.util.Optional;

import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.core;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.isDried;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.numberOrNull;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.optional;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.textOrNull;

/**
 * Maps an OpenFoodFacts {@code /cgi/search.pl} response to the canonical record.
 * Only the first product is used. Values are the provider's {@code *_100g} fields as-is.
 */
public final class OpenFoodFactsSearchMapper {

    private static final double KJ_PER_KCAL = 4.184;

    private OpenFoodFactsSearchMapper() {}

    /** Empty when the response has no products. */
    public static Optional<NutritionSearchResult> map(JsonNode root, Instant fetchedAt) {
        if (root == null || root.isNull()) return Optional.empty();

        JsonNode products = root.path("products");
        if (!products.isArray() || products.isEmpty()) return Optional.empty();

        JsonNode product = products.get(0);
        int total = root.path("count").asInt(products.size());
        return Optional.of(NutritionSearchResult.live(mapProduct(product, fetchedAt), Math.max(total, 1)));
    }

    public static NutritionRecord mapProduct(JsonNode product, Instant fetchedAt) {
        JsonNode nutr = product.path("nutriments");

        Double kcal = numberOrNull(nutr, "energy-kcal_100g");
        if (kcal == null) {
            Double kj = numberOrNull(nutr, "energy-kj_100g");
            if (kj == null) kj = numberOrNull(nutr, "energy_100g"); // energy_100g is kJ
            if (kj != null) kcal = kj / KJ_PER_KCAL;
        }

        String name = textOrNull(product, "product_name_en");
        if (name == null) name = textOrNull(product, "product_name");
        String rawName = textOrNull(product, "product_name");

        JsonNode cats = product.path("categories_tags");
        String category = cats.isArray() && !cats.isEmpty() ? cats.get(0).asText(null) : null;

        NutritionMetadata meta = new NutritionMetadata(
                100,
                "g",
                isDried(rawName),
                category,
                textOrNull(product, "brands"));

        return new NutritionRecord(
                textOrNull(product, "code"),
                name == null ? "Unknown" : name,
                NutritionSource.OPENFOODFACTS,
                fetchedAt,
                core(kcal),
                core(numberOrNull(nutr, "proteins_100g")),
                core(numberOrNull(nutr, "carbohydrates_100g")),
                core(numberOrNull(nutr, "fiber_100g")),
                core(numberOrNull(nutr, "fat_100g")),
                core(numberOrNull(nutr, "sugars_100g")),
                optional(numberOrNull(nutr, "vitamin-c_100g")),
                optional(numberOrNull(nutr, "vitamin-b6_100g")),
                optional(numberOrNull(nutr, "potassium_100g")),
                optional(numberOrNull(nutr, "magnesium_100g")),
                meta);
    }
}
