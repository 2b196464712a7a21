package com.sunya.nutrition.safety;

import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.profile.DietaryRestriction;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.requirements.DailyRequirementCalculator;
import com.sunya.nutrition.safety.NutritionSummary.CalorieDensity;
import com.sunya.nutrition.safety.NutritionSummary.PrimaryMacronutrient;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Deterministic rule engine turning a canonical record and an optional profile into risks,
 * a safe daily range and a recommendation text.
 * <ul>
 *   <li>sugar limit: 50 g, 25 g sugar-sensitive, 15 g diabetic</li>
 *   <li>potassium limit: 4700 mg, 2000 mg potassium-sensitive, 1500 mg kidney disease</li>
 *   <li>acidity: estimated pH against 4.5 for acid reflux</li>
 * </ul>
 */
public class NutritionIntelligenceEngine {

    public static final double SUGAR_LIMIT_NORMAL = 50;
    public static final double SUGAR_LIMIT_SENSITIVE = 25;
    public static final double SUGAR_LIMIT_DIABETES = 15;

    public static final double POTASSIUM_LIMIT_NORMAL = 4700;
    public static final double POTASSIUM_LIMIT_SENSITIVE = 2000;
    public static final double POTASSIUM_LIMIT_KIDNEY = 1500;

    public static final double ACID_REFLUX_PH_THRESHOLD = 4.5;

    static final int MIN_GRAMS = 10;
    static final int MAX_GRAMS_FLOOR = 30;
    static final int MAX_GRAMS_CEILING = 200;
    static final int RECOMMENDED_GRAMS_CAP = 50;
    static final double DAILY_CALORIE_SHARE = 0.1;

    private final DailyRequirementCalculator calculator;
    private final Clock clock;
    private final SafetyValidator safetyValidator;

    public NutritionIntelligenceEngine(DailyRequirementCalculator calculator, Clock clock) {
        this.calculator = calculator;
        this.clock = clock;
        this.safetyValidator = new SafetyValidator(this);
    }

    public SafetyValidator safetyValidator() {
        return safetyValidator;
    }

    // ===== summary =====

    public NutritionSummary generateSummary(NutritionRecord r) {
        CalorieDensity density;
        if (r.calories() < 100) density = CalorieDensity.LOW;
        else if (r.calories() < 250) density = CalorieDensity.MODERATE;
        else density = CalorieDensity.HIGH;

        PrimaryMacronutrient primary = primaryMacronutrient(r);

        List<String> highlights = new ArrayList<>();
        if (r.fiber() >= 5) {
            highlights.add("High in fiber (" + f1(r.fiber()) + "g per 100g)");
        } else if (r.fiber() >= 2) {
            highlights.add("Good source of fiber (" + f1(r.fiber()) + "g per 100g)");
        }
        if (r.vitaminC() != null && r.vitaminC() >= 20) {
            highlights.add("Rich in vitamin C (" + f1(r.vitaminC()) + "mg per 100g)");
        }
        if (r.potassium() != null && r.potassium() >= 300) {
            highlights.add("Good potassium source (" + f0(r.potassium()) + "mg per 100g)");
        }
        if (r.protein() >= 10) {
            highlights.add("High in protein (" + f1(r.protein()) + "g per 100g)");
        }
        if (r.sugar() <= 5) {
            highlights.add("Low in sugar (" + f1(r.sugar()) + "g per 100g)");
        }
        if (highlights.isEmpty()) {
            highlights.add("Contains " + plain(r.calories()) + " calories per 100g");
        }

        return new NutritionSummary(describe(r, density, primary), List.copyOf(highlights), density, primary);
    }

    public static PrimaryMacronutrient primaryMacronutrient(NutritionRecord r) {
        double total = r.protein() + r.carbs() + r.fat();
        if (total == 0) return PrimaryMacronutrient.BALANCED;

        double p = r.protein() / total;
        double c = r.carbs() / total;
        double f = r.fat() / total;
        double max = Math.max(p, Math.max(c, f));

        if (max < 0.45) return PrimaryMacronutrient.BALANCED;
        if (p == max) return PrimaryMacronutrient.PROTEIN;
        if (c == max) return PrimaryMacronutrient.CARBS;
        return PrimaryMacronutrient.FAT;
    }

    private static String describe(NutritionRecord r, CalorieDensity density, PrimaryMacronutrient primary) {
        StringBuilder sb = new StringBuilder(r.name()).append(" is a");
        sb.append(switch (density) {
            case LOW -> " low-calorie";
            case MODERATE -> " moderate-calorie";
            case HIGH -> " calorie-dense";
        });
        switch (primary) {
            case PROTEIN -> sb.append(" protein-rich");
            case CARBS -> sb.append(" carbohydrate-rich");
            case FAT -> sb.append(" fat-rich");
            default -> {
            }
        }
        sb.append(" food");
        if (r.sugar() <= 5) sb.append(" with low sugar content");
        else if (r.sugar() >= 15) sb.append(" with high sugar content");
        if (r.fiber() >= 5) sb.append(" and high fiber");
        return sb.append('.').toString();
    }

    // ===== thresholds =====

    public static double sugarThreshold(UserProfile profile) {
        if (profile == null) return SUGAR_LIMIT_NORMAL;
        if (profile.has(DietaryRestriction.DIABETES)) return SUGAR_LIMIT_DIABETES;
        if (profile.has(DietaryRestriction.SUGAR_SENSITIVE)) return SUGAR_LIMIT_SENSITIVE;
        return SUGAR_LIMIT_NORMAL;
    }

    public static double potassiumThreshold(UserProfile profile) {
        if (profile == null) return POTASSIUM_LIMIT_NORMAL;
        if (profile.has(DietaryRestriction.KIDNEY_DISEASE)) return POTASSIUM_LIMIT_KIDNEY;
        if (profile.has(DietaryRestriction.POTASSIUM_SENSITIVE)) return POTASSIUM_LIMIT_SENSITIVE;
        return POTASSIUM_LIMIT_NORMAL;
    }

    // ===== safe range =====

    public SafeConsumptionRange calculateSafeRange(NutritionRecord r, UserProfile profile) {
        double dailyCalories = calculator.estimateDailyCalories(profile);

        long calorieCap = capGrams(dailyCalories * DAILY_CALORIE_SHARE, r.calories());
        long sugarCap = capGrams(sugarThreshold(profile), r.sugar());
        long potassiumCap = capGrams(potassiumThreshold(profile), r.potassiumOrZero());

        String reason = "Based on calorie limits";
        boolean conservative = false;
        if (sugarCap < calorieCap && sugarCap < potassiumCap) {
            reason = "Limited by sugar content";
            conservative = true;
        } else if (potassiumCap < calorieCap && potassiumCap < sugarCap) {
            reason = "Limited by potassium content";
            conservative = true;
        }

        long binding = Math.min(calorieCap, Math.min(sugarCap, potassiumCap));
        int max = (int) Math.min(Math.max(binding, MAX_GRAMS_FLOOR), MAX_GRAMS_CEILING);
        int recommended = Math.min(RECOMMENDED_GRAMS_CAP, (int) Math.floor(max * 0.5));

        return new SafeConsumptionRange(MIN_GRAMS, max, recommended, reason, conservative);
    }

    // A zero amount places no limit.
    private static long capGrams(double limit, double per100g) {
        if (per100g <= 0) return Long.MAX_VALUE;
        return (long) Math.floor(limit / per100g * 100);
    }

    // ===== risks =====

    public List<DietaryRisk> detectRisks(NutritionRecord r, UserProfile profile) {
        List<DietaryRisk> risks = new ArrayList<>();

        DietaryRisk sugar = sugarRisk(r, profile);
        if (sugar != null) risks.add(sugar);

        DietaryRisk potassium = potassiumRisk(r, profile);
        if (potassium != null) risks.add(potassium);

        DietaryRisk acidity = acidityRisk(r, profile);
        if (acidity != null) risks.add(acidity);

        risks.addAll(allergenRisks(r, profile));
        return risks;
    }

    private static DietaryRisk sugarRisk(NutritionRecord r, UserProfile profile) {
        double threshold = sugarThreshold(profile);
        double pct = r.sugar() / threshold * 100;
        RiskLevel level = RiskLevel.fromPercentage(pct);
        if (level == null) return null;

        boolean applies = profile != null
                && (profile.has(DietaryRestriction.DIABETES) || profile.has(DietaryRestriction.SUGAR_SENSITIVE));

        return new DietaryRisk(
                "High Sugar",
                level,
                "This food contains " + f1(r.sugar()) + "g of sugar per 100g, which is "
                        + f0(pct) + "% of the daily limit.",
                "Sugar",
                r.sugar(),
                threshold,
                "g",
                applies);
    }

    private static DietaryRisk potassiumRisk(NutritionRecord r, UserProfile profile) {
        if (r.potassium() == null || r.potassium() == 0) return null;

        double threshold = potassiumThreshold(profile);
        double pct = r.potassium() / threshold * 100;
        RiskLevel level = RiskLevel.fromPercentage(pct);
        if (level == null) return null;

        boolean applies = profile != null
                && (profile.has(DietaryRestriction.KIDNEY_DISEASE) || profile.has(DietaryRestriction.POTASSIUM_SENSITIVE));

        return new DietaryRisk(
                "High Potassium",
                level,
                "This food contains " + f0(r.potassium()) + "mg of potassium per 100g, which is "
                        + f0(pct) + "% of the daily limit.",
                "Potassium",
                r.potassium(),
                threshold,
                "mg",
                applies);
    }

    private static DietaryRisk acidityRisk(NutritionRecord r, UserProfile profile) {
        if (profile == null || !profile.has(DietaryRestriction.ACID_REFLUX)) return null;
        if (!FoodKeywords.isAcidic(r.name())) return null;

        double ph = FoodKeywords.estimatedPh(r.name());
        RiskLevel level;
        if (ph < 3.5) level = RiskLevel.HIGH;
        else if (ph < 4.0) level = RiskLevel.MODERATE;
        else level = RiskLevel.LOW;

        return new DietaryRisk(
                "Acidic Food",
                level,
                "This food is estimated to be acidic (pH ~" + f1(ph) + "), which may trigger acid reflux symptoms.",
                "Acidity",
                ph,
                ACID_REFLUX_PH_THRESHOLD,
                "pH",
                true);
    }

    private static List<DietaryRisk> allergenRisks(NutritionRecord r, UserProfile profile) {
        if (profile == null) return List.of();
        List<DietaryRisk> out = new ArrayList<>();

        if (profile.has(DietaryRestriction.NUT_ALLERGY) && FoodKeywords.isNut(r.name())) {
            out.add(new DietaryRisk("Nut Allergen", RiskLevel.AVOID,
                    "This food contains nuts, which you are allergic to.",
                    "Nuts", 1, 0, "presence", true));
        }
        if (profile.has(DietaryRestriction.FRUIT_ALLERGY) && FoodKeywords.isFruit(r.name())) {
            out.add(new DietaryRisk("Fruit Allergen", RiskLevel.AVOID,
                    "This food is a fruit, which you are allergic to.",
                    "Fruit", 1, 0, "presence", true));
        }
        return out;
    }

    // ===== recommendation =====

    public String generateRecommendation(NutritionRecord r, UserProfile profile, RecommendationOptions options) {
        RecommendationOptions opt = options == null ? RecommendationOptions.DEFAULTS : options;
        List<DietaryRisk> risks = detectRisks(r, profile);
        SafeConsumptionRange range = calculateSafeRange(r, profile);

        List<DietaryRisk> avoid = risks.stream()
                .filter(x -> x.appliesToProfile() && x.level() == RiskLevel.AVOID)
                .toList();
        if (!avoid.isEmpty()) {
            return "Avoid " + r.name() + ". This food contains " + typesLower(avoid)
                    + ", which may not be suitable for your dietary needs."
                    + " Please consult with a healthcare professional for personalized advice.";
        }

        List<DietaryRisk> high = risks.stream()
                .filter(x -> x.appliesToProfile() && x.level() == RiskLevel.HIGH)
                .toList();
        if (!high.isEmpty() && opt.conservativeMode()) {
            return "Exercise caution with " + r.name() + ". Due to " + typesLower(high)
                    + ", limit consumption to " + range.maxGrams() + "g per day. " + range.reason() + ".";
        }

        StringBuilder sb = new StringBuilder(r.name()).append(" can be enjoyed as part of a balanced diet.");
        if (opt.includeDetails()) {
            sb.append(" A serving of ").append(range.recommendedGrams())
                    .append("g is recommended, with a maximum of ").append(range.maxGrams()).append("g per day.");

            String notes = risks.stream()
                    .limit(Math.max(0, opt.maxRisks()))
                    .filter(DietaryRisk::appliesToProfile)
                    .map(DietaryRisk::description)
                    .collect(Collectors.joining(" "));
            if (!notes.isEmpty()) sb.append(" Note: ").append(notes);
        }
        return sb.toString();
    }

    public NutritionIntelligenceResult analyze(NutritionRecord r, UserProfile profile, RecommendationOptions options) {
        NutritionSummary summary = generateSummary(r);
        SafeConsumptionRange range = calculateSafeRange(r, profile);
        List<DietaryRisk> risks = detectRisks(r, profile);
        String recommendation = generateRecommendation(r, profile, options);
        SafetyValidationResult validation = safetyValidator.validateSafety(r, profile);

        return new NutritionIntelligenceResult(
                summary,
                range,
                List.copyOf(risks),
                recommendation,
                validation.safe(),
                validation.warnings(),
                clock.instant());
    }

    static String typesLower(List<DietaryRisk> risks) {
        return risks.stream().map(x -> x.type().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "));
    }

    static String f1(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    static String f0(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }

    /** 61.0 -> "61", 61.5 -> "61.5" */
    static String plain(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
