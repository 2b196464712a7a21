package com.sunya.nutrition.recommendation;

import com.sunya.nutrition.acquisition.AllSourcesFailedException;
import com.sunya.nutrition.acquisition.NutritionAcquisitionService;
import com.sunya.nutrition.acquisition.NutritionNotFoundException;
import com.sunya.nutrition.catalog.CatalogRepository;
import com.sunya.nutrition.catalog.FoodItem;
import com.sunya.nutrition.catalog.GymFocus;
import com.sunya.nutrition.catalog.NutrientProfile;
import com.sunya.nutrition.matcher.AlternativeSuggestion;
import com.sunya.nutrition.matcher.FruitMatchResult;
import com.sunya.nutrition.matcher.FruitMatcher;
import com.sunya.nutrition.matcher.ProductWithNutrition;
import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.profile.FitnessGoal;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.requirements.DailyRequirementCalculator;
import com.sunya.nutrition.requirements.DailyRequirements;
import com.sunya.nutrition.requirements.ProductIntake;
import com.sunya.nutrition.safety.FoodSafetyCheck;
import com.sunya.nutrition.safety.FoodSafetyRules;
import com.sunya.nutrition.safety.NutritionIntelligenceEngine;
import com.sunya.nutrition.safety.NutritionIntelligenceResult;
import com.sunya.nutrition.safety.RecommendationOptions;
import com.sunya.nutrition.safety.SafeAlternative;
import com.sunya.nutrition.safety.SafetyLevel;
import com.sunya.nutrition.safety.SafetyValidationResult;
import com.sunya.nutrition.safety.SafetyValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Joins lookup, analysis, safety and catalog matching into per-query recommendations, and ranks
 * the whole catalog for a profile.
 */
@Slf4j
@Service
public class RecommendationService {

    static final int DAILY_PACKAGE_SIZE = 5;

    private final NutritionAcquisitionService acquisition;
    private final NutritionIntelligenceEngine engine;
    private final SafetyValidator safetyValidator;
    private final FoodSafetyRules safetyRules;
    private final FruitMatcher matcher;
    private final CatalogRepository catalog;
    private final DailyRequirementCalculator calculator;
    private final Clock clock;

    public RecommendationService(NutritionAcquisitionService acquisition,
                                 NutritionIntelligenceEngine engine,
                                 SafetyValidator safetyValidator,
                                 FoodSafetyRules safetyRules,
                                 FruitMatcher matcher,
                                 CatalogRepository catalog,
                                 DailyRequirementCalculator calculator,
                                 Clock clock) {
        this.acquisition = acquisition;
        this.engine = engine;
        this.safetyValidator = safetyValidator;
        this.safetyRules = safetyRules;
        this.matcher = matcher;
        this.catalog = catalog;
        this.calculator = calculator;
        this.clock = clock;
    }

    public Recommendation recommend(String query, UserProfile profile, RecommendationOptions options) {
        if (query == null || query.isBlank()) throw new IllegalArgumentException("query must not be blank");

        NutritionSearchResult lookup = null;
        NutritionRecord record;
        try {
            lookup = acquisition.fetchNutrition(query);
            record = lookup.record();
        } catch (NutritionNotFoundException | AllSourcesFailedException e) {
            record = catalog.localRecord(query, clock.instant()).orElseThrow(() -> e);
            log.warn("recommend local table fallback query={} reason={}", query, e.getClass().getSimpleName());
        }

        NutritionIntelligenceResult analysis = engine.analyze(record, profile, options);

        FruitMatchResult match = matcher.matchFruitToProduct(query);
        SafetyValidationResult matchSafety = match.hasProduct()
                ? safetyValidator.validateSafety(matcher.withNutrition(match.product()).record(), profile)
                : null;

        AlternativeSuggestion alternative = null;
        if (matchSafety == null || matchSafety.shouldBlock()) {
            alternative = matcher.getBestAlternative(query, profile).orElse(null);
        }

        List<SafeAlternative> safeAlternatives = List.of();
        if (!analysis.safe()) {
            List<NutritionRecord> candidates = matcher.getProductsWithNutrition().stream()
                    .map(ProductWithNutrition::record)
                    .toList();
            safeAlternatives = safetyValidator.getSafeAlternatives(record, profile, candidates);
        }

        return new Recommendation(query, lookup, record, analysis, match, matchSafety, alternative, safeAlternatives);
    }

    /**
     * Every product that is neither blocked by the validator nor graded AVOID, best first
     * (priority, then score), plus a daily package built from the top five.
     */
    public CatalogRanking rankCatalog(UserProfile profile) {
        DailyRequirements req = profile != null && profile.hasBodyMetrics() && profile.activityLevel() != null
                ? calculator.calculateDailyRequirements(profile)
                : calculator.referenceRequirements(profile);
        FitnessGoal goal = profile == null ? FitnessGoal.GENERAL_WELLNESS : profile.goalOrDefault();

        List<RankedProduct> ranked = new ArrayList<>();
        List<FoodSafetyCheck> checks = new ArrayList<>();
        for (ProductWithNutrition pn : matcher.getProductsWithNutrition()) {
            NutrientProfile n = pn.nutrition();
            String name = pn.product().name();
            SafetyValidationResult v = safetyValidator.validateSafety(pn.record(), profile);

            if (v.shouldBlock()) {
                checks.add(safetyRules.avoid(name, n, profile, v.warnings()));
                continue;
            }
            FoodSafetyCheck check = safetyRules.check(name, n, profile);
            checks.add(check);
            if (check.level() == SafetyLevel.AVOID) continue;

            SafetyLevel level = check.level().worse(v.warnings().isEmpty() ? SafetyLevel.SAFE : SafetyLevel.CAUTION);
            FoodItem food = catalog.findDehydrated(pn.fruitName()).orElse(null);
            GymFocus focus = food == null ? GymFocus.GENERAL : food.gymFocus();

            int score = matchScore(n, req, level, focus, goal);
            ProductIntake intake = calculator.calculateProductIntake(req, n.calories(), n.protein(), n.fiber());

            ranked.add(new RankedProduct(
                    pn.product(),
                    pn.fruitName(),
                    score,
                    Priority.of(score),
                    level,
                    v.warnings(),
                    check,
                    engine.calculateSafeRange(pn.record(), profile),
                    intake,
                    n.scaledTo(intake.grams()),
                    food == null ? List.of() : food.benefits()));
        }

        ranked.sort(Comparator.comparing(RankedProduct::priority)
                .thenComparing(Comparator.comparingInt(RankedProduct::matchScore).reversed()));

        List<FoodSafetyCheck> unsafe = checks.stream().filter(c -> c.level() != SafetyLevel.SAFE).toList();
        log.debug("catalog ranking built ranked={} unsafe={} goal={}", ranked.size(), unsafe.size(), goal);
        return new CatalogRanking(req, List.copyOf(ranked), dailyPackage(ranked, req),
                unsafe, safetyRules.summarize(checks), safetyRules.advice(profile));
    }

    static int matchScore(NutrientProfile n, DailyRequirements req, SafetyLevel level,
                          GymFocus focus, FitnessGoal goal) {
        int score = switch (level) {
            case SAFE -> 40;
            case CAUTION -> 20;
            case AVOID -> 0;
        };

        if (ratio(n.protein(), req.protein()) > 0.1) score += 15;
        if (ratio(n.fiber(), req.fiber()) > 0.15) score += 15;
        if (ratio(n.vitaminC(), req.vitaminC()) > 0.2) score += 10;

        score += focus.supports(goal) ? 10 : 5;
        return Math.min(score, 100);
    }

    static DailyPackage dailyPackage(List<RankedProduct> ranked, DailyRequirements req) {
        List<RankedProduct> top = ranked.stream().limit(DAILY_PACKAGE_SIZE).toList();

        double cal = 0, protein = 0, carbs = 0, fiber = 0, fat = 0, price = 0;
        for (RankedProduct r : top) {
            NutrientProfile c = r.contribution();
            cal += c.calories();
            protein += c.protein();
            carbs += c.carbs();
            fiber += c.fiber();
            fat += c.fat();
            price += r.product().nrsPrice() / 1000.0 * r.intake().grams();
        }

        long coverage = req.calories() <= 0 ? 0 : Math.round(cal / req.calories() * 100);
        return new DailyPackage(top, cal, protein, carbs, fiber, fat, Math.round(price), coverage,
                coverage >= 80 && coverage <= 120);
    }

    private static double ratio(double have, double need) {
        return need <= 0 ? 0 : have / need;
    }
}
