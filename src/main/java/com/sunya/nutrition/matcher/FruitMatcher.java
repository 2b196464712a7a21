package com.sunya.nutrition.matcher;

import com.sunya.nutrition.catalog.CatalogRepository;
import com.sunya.nutrition.catalog.FoodItem;
import com.sunya.nutrition.catalog.NutrientProfile;
import com.sunya.nutrition.catalog.Product;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.safety.SafetyValidationResult;
import com.sunya.nutrition.safety.SafetyValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Maps free-text fruit queries to catalog products.
 * <p>
 * Tiers are tried strictly in order: EXACT (product name or its fruit name), SYNONYM, PARTIAL
 * (containment either way), otherwise NONE. {@link #findSimilarFruits} ranks by nutrition instead
 * of name.
 */
@Slf4j
public class FruitMatcher {

    static final String LIMITED_BADGE = "Limited Seasonal";

    static final double CALORIES_RANGE = 500;
    static final double CARBS_RANGE = 100;
    static final double FIBER_RANGE = 20;
    static final double VITAMIN_C_RANGE = 500;
    static final double POTASSIUM_RANGE = 2000;
    static final double MAGNESIUM_RANGE = 500;
    static final double VITAMIN_B6_RANGE = 2;

    private final CatalogRepository catalog;
    private final SafetyValidator safetyValidator;
    private final MatchOptions options;
    private final Instant snapshotAt;
    private final Map<Long, ProductWithNutrition> enriched;

    public FruitMatcher(CatalogRepository catalog, SafetyValidator safetyValidator, MatchOptions options,
                        Instant snapshotAt) {
        this.catalog = catalog;
        this.safetyValidator = safetyValidator;
        this.options = options == null ? MatchOptions.DEFAULTS : options;
        this.snapshotAt = snapshotAt;

        Map<Long, ProductWithNutrition> m = new LinkedHashMap<>();
        for (Product p : catalog.products()) {
            m.put(p.id(), enrich(p));
        }
        this.enriched = m;
        log.info("fruit_matcher ready products={} synonyms={} threshold={}",
                m.size(), this.options.includeSynonyms(), this.options.minSimilarityThreshold());
    }

    public MatchOptions options() {
        return options;
    }

    public List<ProductWithNutrition> getProductsWithNutrition() {
        return List.copyOf(enriched.values());
    }

    public ProductWithNutrition withNutrition(Product p) {
        ProductWithNutrition e = enriched.get(p.id());
        return e != null && e.product().equals(p) ? e : enrich(p);
    }

    // ===== name tiers =====

    public FruitMatchResult matchFruitToProduct(String searched) {
        return matchFruitToProduct(searched, catalog.products());
    }

    public FruitMatchResult matchFruitToProduct(String searched, List<Product> products) {
        String q = normalize(searched);
        if (q.isEmpty() || products == null || products.isEmpty()) return FruitMatchResult.none(searched);

        Optional<Product> exact = first(products, p -> normalize(p.name()).equals(q) || fruitName(p).equals(q));
        if (exact.isPresent()) return named(exact.get(), MatchType.EXACT, "Exact name match found", searched);

        if (options.includeSynonyms()) {
            Optional<Product> syn = findSynonymMatch(q, products);
            if (syn.isPresent()) return named(syn.get(), MatchType.SYNONYM, "Synonym match found", searched);
        }

        Optional<Product> partial = first(products, p -> {
            String name = normalize(p.name());
            String fruit = fruitName(p);
            return name.contains(q) || q.contains(name)
                    || (!fruit.isEmpty() && (fruit.contains(q) || q.contains(fruit)));
        });
        if (partial.isPresent()) return named(partial.get(), MatchType.PARTIAL, "Partial name match found", searched);

        return FruitMatchResult.none(searched);
    }

    private Optional<Product> findSynonymMatch(String q, List<Product> products) {
        for (Map.Entry<String, List<String>> e : FruitSynonyms.TABLE.entrySet()) {
            String base = e.getKey();
            List<String> synonyms = e.getValue();

            if (synonyms.contains(q)) {
                Optional<Product> p = first(products, x -> fruitName(x).equals(base))
                        .or(() -> first(products, x -> normalize(x.name()).contains(base)));
                if (p.isPresent()) return p;
            }
            if (base.equals(q)) {
                Optional<Product> p = first(products, x -> {
                    String name = normalize(x.name());
                    return synonyms.stream().anyMatch(name::contains);
                });
                if (p.isPresent()) return p;
            }
        }
        return Optional.empty();
    }

    private FruitMatchResult named(Product p, MatchType type, String reason, String searched) {
        return new FruitMatchResult(
                p,
                type,
                type.fixedScore(),
                withNutrition(p).availabilityStatus(),
                reason,
                searched,
                p.name(),
                false,
                null);
    }

    // ===== nutritional similarity =====

    public List<FruitMatchResult> findSimilarFruits(String searched) {
        return findSimilarFruits(searched, catalog.products());
    }

    public List<FruitMatchResult> findSimilarFruits(String searched, List<Product> products) {
        Optional<NutrientProfile> target = catalog.findFood(searched).map(FoodItem::nutrition);
        if (target.isEmpty() || products == null) return List.of();

        List<FruitMatchResult> out = new ArrayList<>();
        for (Product p : products) {
            ProductWithNutrition pn = withNutrition(p);
            NutritionalSimilarityScore s = calculateNutritionalSimilarity(target.get(), pn.nutrition());
            if (s.overallScore() < options.minSimilarityThreshold()) continue;

            out.add(new FruitMatchResult(
                    p,
                    MatchType.SIMILAR,
                    s.overallScore(),
                    pn.availabilityStatus(),
                    "Nutritionally similar (" + s.overallScore() + "% match)",
                    searched,
                    p.name(),
                    true,
                    s));
        }
        out.sort(Comparator.comparingInt(FruitMatchResult::similarityScore).reversed());
        return out;
    }

    public NutritionalSimilarityScore calculateNutritionalSimilarity(NutrientProfile a, NutrientProfile b) {
        int calories = subScore(a.calories(), b.calories(), CALORIES_RANGE);
        int carbs = subScore(a.carbs(), b.carbs(), CARBS_RANGE);
        int fiber = subScore(a.fiber(), b.fiber(), FIBER_RANGE);

        int vitC = subScore(a.vitaminC(), b.vitaminC(), VITAMIN_C_RANGE);
        int potassium = subScore(a.potassium(), b.potassium(), POTASSIUM_RANGE);
        int magnesium = subScore(a.magnesium(), b.magnesium(), MAGNESIUM_RANGE);
        int b6 = subScore(a.vitaminB6(), b.vitaminB6(), VITAMIN_B6_RANGE);
        int vitamins = (int) Math.round((vitC + potassium + magnesium + b6) / 4.0);

        double w = NutritionalSimilarityScore.WEIGHT;
        int overall = (int) Math.round(calories * w + carbs * w + fiber * w + vitamins * w);
        return new NutritionalSimilarityScore(overall, calories, carbs, fiber, vitamins);
    }

    static int subScore(double v1, double v2, double range) {
        return (int) Math.round(Math.max(0, 100 - Math.abs(v1 - v2) / range * 100));
    }

    // ===== alternatives =====

    public Optional<AlternativeSuggestion> getBestAlternative(String searched, UserProfile profile) {
        return getBestAlternative(searched, catalog.products(), profile);
    }

    public Optional<AlternativeSuggestion> getBestAlternative(String searched, List<Product> products,
                                                              UserProfile profile) {
        return findAlternatives(searched, products, profile, 1).stream().findFirst();
    }

    /**
     * Similar products, safety-filtered when a profile is given and unsafe filtering is on,
     * each carrying its own warnings.
     */
    public List<AlternativeSuggestion> findAlternatives(String searched, List<Product> products,
                                                        UserProfile profile, int limit) {
        List<AlternativeSuggestion> out = new ArrayList<>();
        for (FruitMatchResult r : findSimilarFruits(searched, products)) {
            if (out.size() >= limit) break;

            ProductWithNutrition pn = withNutrition(r.product());
            SafetyValidationResult v = safetyValidator.validateSafety(pn.record(), profile);
            if (profile != null && options.filterUnsafe() && v.shouldBlock()) continue;

            out.add(new AlternativeSuggestion(
                    r.product(),
                    r.similarityScore(),
                    r.nutritionalSimilarity(),
                    r.reason(),
                    v.safe(),
                    v.warnings(),
                    r.matchType()));
        }
        return out;
    }

    public List<AlternativeSuggestion> findAlternatives(String searched, UserProfile profile) {
        return findAlternatives(searched, catalog.products(), profile, options.maxAlternatives());
    }

    // ===== helpers =====

    private ProductWithNutrition enrich(Product p) {
        String fruit = fruitName(p);
        NutrientProfile n = fruit.isEmpty()
                ? NutrientProfile.FALLBACK
                : catalog.findDehydrated(fruit).map(FoodItem::nutrition).orElse(NutrientProfile.FALLBACK);
        AvailabilityStatus status = LIMITED_BADGE.equals(p.badge())
                ? AvailabilityStatus.LIMITED
                : AvailabilityStatus.IN_STOCK;
        return new ProductWithNutrition(p, fruit, n, status,
                n.toRecord("product-" + p.id(), p.name(), true, snapshotAt));
    }

    static String normalize(String s) {
        if (s == null) return "";
        return s.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /** "Dried Kiwi" -> "kiwi" */
    static String fruitName(Product p) {
        return normalize(normalize(p.name())
                .replace("dehydrated", " ")
                .replace("dried", " "));
    }

    private static Optional<Product> first(List<Product> products, Predicate<Product> test) {
        return products.stream().filter(test).findFirst();
    }
}
