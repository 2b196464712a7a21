package com.sunya.nutrition.acquisition.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunya.nutrition.model.NutritionMetadata;
import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.core;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.isDried;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.numberOrNull;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.optional;
import static com.sunya.nutrition.acquisition.mapper.NutrientNumbers.textOrNull;

/**
 * Maps a FoodData Central {@code /fdc/v1/foods/search} response to the canonical record.
 * Nutrients are looked up by case-insensitive substring of {@code nutrientName}.
 */
public final class UsdaFoodMapper {

    private UsdaFoodMapper() {}

    public static Optional<NutritionSearchResult> map(JsonNode root, Instant fetchedAt) {
        if (root == null || root.isNull()) return Optional.empty();

        JsonNode foods = root.path("foods");
        if (!foods.isArray() || foods.isEmpty()) return Optional.empty();

        int total = root.path("totalHits").asInt(foods.size());
        return Optional.of(NutritionSearchResult.live(mapFood(foods.get(0), fetchedAt), Math.max(total, 1)));
    }

    public static NutritionRecord mapFood(JsonNode food, Instant fetchedAt) {
        JsonNode nutrients = food.path("foodNutrients");
        String description = textOrNull(food, "description");

        Double servingSize = numberOrNull(food, "servingSize");
        String servingUnit = textOrNull(food, "servingSizeUnit");

        NutritionMetadata meta = new NutritionMetadata(
                servingSize == null || servingSize <= 0 ? 100 : servingSize,
                servingUnit == null ? "g" : servingUnit,
                isDried(description),
                textOrNull(food, "foodCategory"),
                textOrNull(food, "brandOwner"));

        return new NutritionRecord(
                textOrNull(food, "fdcId"),
                description == null ? "Unknown" : description,
                NutritionSource.USDA,
                fetchedAt,
                core(energyKcal(nutrients)),
                core(nutrient(nutrients, "Protein")),
                core(nutrient(nutrients, "Carbohydrate")),
                core(nutrient(nutrients, "Fiber")),
                core(nutrient(nutrients, "Total lipid")),
                core(nutrient(nutrients, "Sugars")),
                optional(nutrient(nutrients, "Vitamin C")),
                optional(nutrient(nutrients, "Vitamin B-6")),
                optional(nutrient(nutrients, "Potassium")),
                optional(nutrient(nutrients, "Magnesium")),
                meta);
    }

    /** First nutrient whose name contains {@code name}, ignoring case. */
    static Double nutrient(JsonNode nutrients, String name) {
        if (!nutrients.isArray()) return null;
        String needle = name.toLowerCase(Locale.ROOT);
        for (JsonNode n : nutrients) {
            String nn = n.path("nutrientName").asText("").toLowerCase(Locale.ROOT);
            if (nn.contains(needle)) return numberOrNull(n, "value");
        }
        return null;
    }

    /** Energy rows come in kcal and kJ; the kcal row wins when both are present. */
    static Double energyKcal(JsonNode nutrients) {
        if (nutrients.isArray()) {
            for (JsonNode n : nutrients) {
                String nn = n.path("nutrientName").asText("").toLowerCase(Locale.ROOT);
                String unit = n.path("unitName").asText("");
                if (nn.contains("energy") && "KCAL".equalsIgnoreCase(unit)) return numberOrNull(n, "value");
            }
        }
        return nutrient(nutrients, "Energy");
    }
}
