package com.sunya.nutrition.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.model.NutritionRecord;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable snapshot of the product catalog and the local nutrition table.
 */
public class CatalogRepository {

    private static final List<String> DRIED_WORDS = List.of("dried", "dehydrated");

    private final List<Product> products;
    private final List<FoodItem> foods;

    public CatalogRepository(List<Product> products, List<FoodItem> foods) {
        this.products = List.copyOf(products);
        this.foods = List.copyOf(foods);
    }

    public static CatalogRepository load(ObjectMapper om, InputStream productsJson, InputStream foodsJson)
            throws IOException {
        List<Product> p = om.readValue(productsJson, new TypeReference<List<Product>>() {});
        List<FoodItem> f = om.readValue(foodsJson, new TypeReference<List<FoodItem>>() {});
        return new CatalogRepository(p, f);
    }

    public List<Product> products() {
        return products;
    }

    public List<FoodItem> foods() {
        return foods;
    }

    public Optional<Product> findProduct(long id) {
        return products.stream().filter(p -> p.id() == id).findFirst();
    }

    /**
     * Resolves free text against the nutrition table: full name containment in either
     * direction first, then the fruit base name. Dehydrated rows win when the query mentions
     * drying, fresh rows otherwise.
     */
    public Optional<FoodItem> findFood(String query) {
        if (query == null || query.isBlank()) return Optional.empty();
        String q = query.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        boolean wantsDried = DRIED_WORDS.stream().anyMatch(q::contains);

        String bare = q;
        for (String w : DRIED_WORDS) bare = bare.replace(w, " ");
        String stripped = bare.trim().replaceAll("\\s+", " ");

        FoodType preferred = wantsDried ? FoodType.DEHYDRATED : FoodType.FRESH;
        return foods.stream()
                .filter(f -> {
                    String n = f.name().toLowerCase(Locale.ROOT);
                    return n.contains(q) || q.contains(n) || q.contains(f.baseName());
                })
                .min(Comparator
                        .comparingInt((FoodItem f) -> f.baseName().equals(stripped) ? 0 : 1)
                        .thenComparingInt(f -> f.type() == preferred ? 0 : 1));
    }

    /**
     * Dehydrated table row for a fruit name, preferring an exact base-name match so that
     * "apple" resolves to apple rather than pineapple.
     */
    public Optional<FoodItem> findDehydrated(String fruitName) {
        String n = fruitName.toLowerCase(Locale.ROOT).trim();
        return foods.stream()
                .filter(f -> f.type() == FoodType.DEHYDRATED)
                .filter(f -> f.name().toLowerCase(Locale.ROOT).contains(n))
                .min(Comparator.comparingInt((FoodItem f) -> f.baseName().equals(n) ? 0 : 1));
    }

    /** Canonical record built from the table, used when no provider can answer. */
    public Optional<NutritionRecord> localRecord(String query, Instant at) {
        return findFood(query).map(f ->
                f.nutrition().toRecord(f.id(), f.name(), f.type() == FoodType.DEHYDRATED, at));
    }
}
