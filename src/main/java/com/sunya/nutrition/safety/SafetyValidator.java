package com.sunya.nutrition.safety;

import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.profile.DietaryRestriction;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.safety.NutritionSummary.PrimaryMacronutrient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Blocking decisions on top of {@link NutritionIntelligenceEngine}.
 * <p>
 * Without a profile nothing is blocked. With a profile a record is blocked when a HIGH or AVOID
 * risk applies to it, or when its name hits an allergen or custom-sensitivity keyword.
 */
public class SafetyValidator {

    static final int MAX_ALTERNATIVES = 3;

    private final NutritionIntelligenceEngine engine;

    SafetyValidator(NutritionIntelligenceEngine engine) {
        this.engine = engine;
    }

    public SafetyValidationResult validateSafety(NutritionRecord r, UserProfile profile) {
        if (profile == null) return SafetyValidationResult.unrestricted();

        List<String> warnings = new ArrayList<>();
        boolean block = false;
        String reason = null;

        List<DietaryRisk> risks = engine.detectRisks(r, profile);

        List<DietaryRisk> avoid = applying(risks, RiskLevel.AVOID);
        if (!avoid.isEmpty()) {
            block = true;
            reason = "Contains " + NutritionIntelligenceEngine.typesLower(avoid);
            avoid.forEach(x -> warnings.add(x.description()));
        }

        List<DietaryRisk> high = applying(risks, RiskLevel.HIGH);
        if (!high.isEmpty()) {
            block = true;
            if (reason == null) reason = "High in " + NutritionIntelligenceEngine.typesLower(high);
            high.forEach(x -> warnings.add(x.description()));
        }

        List<String> allergens = checkAllergens(r, profile);
        if (!allergens.isEmpty()) {
            block = true;
            if (reason == null) reason = String.join(", ", allergens);
            warnings.addAll(allergens);
        }

        warnings.addAll(checkDietaryRestrictions(r, profile));

        List<String> custom = checkCustomSensitivities(r, profile);
        if (!custom.isEmpty()) {
            block = true;
            if (reason == null) reason = "Matches custom sensitivities";
            warnings.addAll(custom);
        }

        return new SafetyValidationResult(!block, List.copyOf(warnings), block, reason);
    }

    public boolean isSafeForProfile(NutritionRecord r, UserProfile profile) {
        return validateSafety(r, profile).safe();
    }

    public List<String> getSafetyWarnings(NutritionRecord r, UserProfile profile) {
        return validateSafety(r, profile).warnings();
    }

    public boolean shouldBlockRecommendation(NutritionRecord r, UserProfile profile) {
        return validateSafety(r, profile).shouldBlock();
    }

    public SafetyReport getSafetyReport(NutritionRecord r, UserProfile profile) {
        SafetyValidationResult v = validateSafety(r, profile);
        return new SafetyReport(
                v.safe(),
                v.warnings(),
                v.shouldBlock(),
                v.blockReason(),
                engine.detectRisks(r, profile),
                engine.generateRecommendation(r, profile, RecommendationOptions.CONSERVATIVE));
    }

    /**
     * Up to three safe candidates ranked by closeness to {@code r}. Empty without a profile.
     */
    public List<SafeAlternative> getSafeAlternatives(NutritionRecord r, UserProfile profile,
                                                     List<NutritionRecord> candidates) {
        if (profile == null || candidates == null) return List.of();

        record Scored(NutritionRecord food, double score) {}

        return candidates.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.id() == null || !c.id().equals(r.id()))
                .filter(c -> isSafeForProfile(c, profile))
                .map(c -> new Scored(c, similarity(r, c)))
                .sorted(Comparator.comparingDouble(Scored::score).reversed())
                .limit(MAX_ALTERNATIVES)
                .map(s -> new SafeAlternative(
                        s.food(),
                        alternativeReason(r, s.food(), profile),
                        comparison(r, s.food())))
                .toList();
    }

    static double similarity(NutritionRecord a, NutritionRecord b) {
        double score = Math.max(0, 100 - Math.abs(a.calories() - b.calories()));
        PrimaryMacronutrient pa = NutritionIntelligenceEngine.primaryMacronutrient(a);
        PrimaryMacronutrient pb = NutritionIntelligenceEngine.primaryMacronutrient(b);
        if (pa == pb) score += 50;
        score += Math.max(0, 50 - Math.abs(a.fiber() - b.fiber()) * 5);
        return score;
    }

    private String alternativeReason(NutritionRecord original, NutritionRecord alt, UserProfile profile) {
        List<DietaryRisk> originalRisks = engine.detectRisks(original, profile);
        List<DietaryRisk> altRisks = engine.detectRisks(alt, profile);

        List<DietaryRisk> originalAvoid = ofLevel(originalRisks, RiskLevel.AVOID);
        if (!originalAvoid.isEmpty() && ofLevel(altRisks, RiskLevel.AVOID).isEmpty()) {
            return "Does not contain " + NutritionIntelligenceEngine.typesLower(originalAvoid);
        }

        List<DietaryRisk> originalHigh = ofLevel(originalRisks, RiskLevel.HIGH);
        if (!originalHigh.isEmpty() && ofLevel(altRisks, RiskLevel.HIGH).isEmpty()) {
            return "Lower in " + NutritionIntelligenceEngine.typesLower(originalHigh);
        }

        return "Safer alternative based on your profile";
    }

    static String comparison(NutritionRecord original, NutritionRecord alt) {
        List<String> parts = new ArrayList<>();

        double cal = alt.calories() - original.calories();
        if (Math.abs(cal) > 20) {
            parts.add(cal < 0
                    ? NutritionIntelligenceEngine.plain(Math.abs(cal)) + " fewer calories per 100g"
                    : NutritionIntelligenceEngine.plain(cal) + " more calories per 100g");
        }

        double sugar = alt.sugar() - original.sugar();
        if (Math.abs(sugar) > 2) {
            parts.add(sugar < 0
                    ? NutritionIntelligenceEngine.f1(Math.abs(sugar)) + "g less sugar per 100g"
                    : NutritionIntelligenceEngine.f1(sugar) + "g more sugar per 100g");
        }

        double fiber = alt.fiber() - original.fiber();
        if (Math.abs(fiber) > 1) {
            parts.add(fiber > 0
                    ? NutritionIntelligenceEngine.f1(fiber) + "g more fiber per 100g"
                    : NutritionIntelligenceEngine.f1(Math.abs(fiber)) + "g less fiber per 100g");
        }

        return parts.isEmpty() ? "Similar nutritional profile" : String.join(", ", parts);
    }

    private static List<String> checkAllergens(NutritionRecord r, UserProfile profile) {
        List<String> out = new ArrayList<>();
        if (profile.has(DietaryRestriction.NUT_ALLERGY) && FoodKeywords.isNut(r.name())) {
            out.add("Contains nuts - you have a nut allergy");
        }
        if (profile.has(DietaryRestriction.FRUIT_ALLERGY) && FoodKeywords.isFruit(r.name())) {
            out.add("This is a fruit - you have a fruit allergy");
        }
        return out;
    }

    private static List<String> checkDietaryRestrictions(NutritionRecord r, UserProfile profile) {
        List<String> out = new ArrayList<>();
        String sugar = NutritionIntelligenceEngine.f1(r.sugar());

        if (profile.has(DietaryRestriction.DIABETES) && r.sugar() > 10) {
            out.add("High sugar content (" + sugar + "g per 100g) - may not be suitable for diabetes");
        } else if (profile.has(DietaryRestriction.SUGAR_SENSITIVE) && r.sugar() > 15) {
            out.add("Moderate to high sugar content (" + sugar + "g per 100g) - you are sugar sensitive");
        }

        if (r.potassium() != null && r.potassium() > 0) {
            String k = NutritionIntelligenceEngine.f0(r.potassium());
            if (profile.has(DietaryRestriction.KIDNEY_DISEASE) && r.potassium() > 200) {
                out.add("High potassium content (" + k + "mg per 100g) - may not be suitable for kidney disease");
            } else if (profile.has(DietaryRestriction.POTASSIUM_SENSITIVE) && r.potassium() > 300) {
                out.add("Moderate to high potassium content (" + k + "mg per 100g) - you are potassium sensitive");
            }
        }

        if (profile.has(DietaryRestriction.ACID_REFLUX) && FoodKeywords.isAcidic(r.name())) {
            out.add("Acidic food - may trigger acid reflux symptoms");
        }

        if (profile.has(DietaryRestriction.LOW_FIBER) && r.fiber() > 5) {
            out.add("High fiber content (" + NutritionIntelligenceEngine.f1(r.fiber()) + "g per 100g) - you follow a low fiber diet");
        }
        if (profile.has(DietaryRestriction.HIGH_FIBER) && r.fiber() < 5) {
            out.add("Low fiber content (" + NutritionIntelligenceEngine.f1(r.fiber()) + "g per 100g) - you follow a high fiber diet");
        }
        if (profile.has(DietaryRestriction.LOW_PROTEIN) && r.protein() > 5) {
            out.add("High protein content (" + NutritionIntelligenceEngine.f1(r.protein()) + "g per 100g) - you follow a low protein diet");
        }
        if (profile.has(DietaryRestriction.HIGH_PROTEIN) && r.protein() < 2) {
            out.add("Low protein content (" + NutritionIntelligenceEngine.f1(r.protein()) + "g per 100g) - you follow a high protein diet");
        }
        return out;
    }

    private static List<String> checkCustomSensitivities(NutritionRecord r, UserProfile profile) {
        String name = FoodKeywords.lower(r.name());
        List<String> out = new ArrayList<>();
        for (String s : profile.customSensitivities()) {
            if (name.contains(s.toLowerCase(Locale.ROOT).trim())) {
                out.add("Matches custom sensitivity: " + s);
            }
        }
        return out;
    }

    private static List<DietaryRisk> applying(List<DietaryRisk> risks, RiskLevel level) {
        return risks.stream().filter(x -> x.appliesToProfile() && x.level() == level).toList();
    }

    private static List<DietaryRisk> ofLevel(List<DietaryRisk> risks, RiskLevel level) {
        return risks.stream().filter(x -> x.level() == level).toList();
    }
}
