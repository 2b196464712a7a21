package com.sunya.nutrition.safety;

import com.sunya.nutrition.catalog.NutrientProfile;
import com.sunya.nutrition.profile.DietaryRestriction;
import com.sunya.nutrition.profile.UserProfile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static com.sunya.nutrition.profile.DietaryRestriction.*;

/**
 * Health-condition and age-group rules over the per-100 g catalog table.
 * <p>
 * Works on {@link NutrientProfile} rather than provider records because the age rules need
 * antioxidants, which no provider reports. A failed rule downgrades the food to
 * {@link SafetyLevel#CAUTION}; these rules never exclude a food on their own.
 */
public class FoodSafetyRules {

    static final String NO_RESTRICTIONS = "No specific health restrictions";
    static final String AGE_REASON = "May not be optimal for your age group";
    static final String AGE_NOTE = "Use with caution - consider alternatives";
    static final String DEFAULT_NOTE = "Safe for your condition";
    static final String AVOID_NOTE = "Avoid due to health condition";

    record Rule(DietaryRestriction condition, Predicate<NutrientProfile> check,
                String passReason, String passNote, String failReason, String failNote) {

        static Rule always(DietaryRestriction condition, String reason, String note) {
            return new Rule(condition, n -> true, reason, note, reason, note);
        }
    }

    enum AgeGroup {
        CHILD(0, 12, n -> n.calories() >= 200 && n.vitaminC() >= 30),
        TEENAGER(13, 19, n -> n.calories() >= 250 && n.protein() >= 3),
        ADULT(20, 59, n -> n.fiber() >= 5 && n.antioxidants() >= 2000),
        SENIOR(60, 120, n -> n.fiber() >= 8 && n.antioxidants() >= 3000);

        final int minAge;
        final int maxAge;
        final Predicate<NutrientProfile> suitable;

        AgeGroup(int minAge, int maxAge, Predicate<NutrientProfile> suitable) {
            this.minAge = minAge;
            this.maxAge = maxAge;
            this.suitable = suitable;
        }

        static AgeGroup of(Integer age) {
            if (age == null) return null;
            for (AgeGroup g : values()) {
                if (age >= g.minAge && age <= g.maxAge) return g;
            }
            return null;
        }
    }

    static final List<Rule> RULES = List.of(
            new Rule(DIABETES, n -> n.carbs() <= 70,
                    "Moderate carbohydrate content", "Safe for your condition - moderate carbs",
                    "High carbohydrate content may affect blood sugar levels",
                    "Limit due to high carbs - monitor blood sugar"),
            new Rule(DIABETES, n -> n.fiber() >= 8,
                    "High fiber helps regulate blood sugar",
                    "Safe for your condition - fiber helps blood sugar control",
                    "Low fiber gives little blood sugar control", "Limit portions - low fiber"),
            new Rule(HYPERTENSION, n -> n.potassium() >= 400,
                    "High potassium helps lower blood pressure",
                    "Safe for your condition - potassium supports heart health",
                    "Little potassium to support blood pressure", "Use with caution - little potassium"),
            // dried fruit carries no added salt
            Rule.always(HYPERTENSION, "Naturally low in sodium", "Safe for your condition - naturally low sodium"),
            Rule.always(SODIUM_SENSITIVE, "Naturally low in sodium", "Safe for your condition - naturally low sodium"),
            new Rule(HEART_DISEASE, n -> n.fiber() >= 6,
                    "High fiber supports cardiovascular health",
                    "Safe for your condition - fiber supports heart health",
                    "Low fiber gives little cardiovascular support", "Use with caution - low fiber"),
            new Rule(HEART_DISEASE, n -> n.fat() <= 5,
                    "Low fat content is heart-healthy", "Safe for your condition - low fat content",
                    "High fat content may strain heart health", "Limit due to high fat"),
            new Rule(KIDNEY_DISEASE, n -> n.potassium() <= 500,
                    "Moderate potassium level suitable for kidney health",
                    "Safe for your condition - moderate potassium",
                    "High potassium may burden the kidneys", "Limit due to high potassium"),
            new Rule(KIDNEY_DISEASE, n -> n.protein() <= 5,
                    "Moderate protein level suitable for kidney health",
                    "Safe for your condition - moderate protein",
                    "High protein may burden the kidneys", "Limit due to high protein"),
            Rule.always(NUT_ALLERGY, "Naturally free of common allergens",
                    "Safe for your condition - naturally allergen-free"),
            Rule.always(GLUTEN_INTOLERANCE, "Naturally free of common allergens",
                    "Safe for your condition - naturally allergen-free"),
            Rule.always(LACTOSE_INTOLERANCE, "Naturally free of common allergens",
                    "Safe for your condition - naturally allergen-free")
    );

    public FoodSafetyCheck check(String foodName, NutrientProfile n, UserProfile profile) {
        Set<String> reasons = new LinkedHashSet<>();
        SafetyLevel level = SafetyLevel.SAFE;
        String note = DEFAULT_NOTE;

        AgeGroup group = profile == null ? null : AgeGroup.of(profile.age());
        if (group != null && !group.suitable.test(n)) {
            level = SafetyLevel.CAUTION;
            reasons.add(AGE_REASON);
            note = AGE_NOTE;
        }

        List<Rule> applicable = profile == null
                ? List.of()
                : RULES.stream().filter(r -> profile.has(r.condition())).toList();
        if (applicable.isEmpty()) {
            reasons.add(NO_RESTRICTIONS);
            return result(foodName, n, profile, level, reasons, note);
        }

        String firstFailure = null;
        String lastPass = null;
        for (Rule r : applicable) {
            if (r.check().test(n)) {
                reasons.add(r.passReason());
                lastPass = r.passNote();
            } else {
                reasons.add(r.failReason());
                level = level.worse(SafetyLevel.CAUTION);
                if (firstFailure == null) firstFailure = r.failNote();
            }
        }
        if (firstFailure != null) note = firstFailure;
        else if (level == SafetyLevel.SAFE) note = lastPass;

        return result(foodName, n, profile, level, reasons, note);
    }

    /** Verdict for a food that another rule set already excludes outright. */
    public FoodSafetyCheck avoid(String foodName, NutrientProfile n, UserProfile profile, List<String> reasons) {
        return new FoodSafetyCheck(foodName, false, SafetyLevel.AVOID, List.copyOf(reasons),
                alternatives(n, profile), AVOID_NOTE);
    }

    public SafetySummary summarize(List<FoodSafetyCheck> checks) {
        int safe = 0, caution = 0, avoid = 0;
        for (FoodSafetyCheck c : checks) {
            switch (c.level()) {
                case SAFE -> safe++;
                case CAUTION -> caution++;
                case AVOID -> avoid++;
            }
        }
        int total = checks.size();
        long pct = total == 0 ? 0 : Math.round(safe * 100.0 / total);
        return new SafetySummary(safe, caution, avoid, total, pct);
    }

    public String advice(UserProfile profile) {
        List<String> advice = new ArrayList<>();
        if (profile != null) {
            if (profile.has(DIABETES)) {
                advice.add("Focus on high-fiber, lower-carb options like berries and apples");
                advice.add("Monitor portion sizes and pair with protein");
            }
            if (profile.has(HYPERTENSION)) {
                advice.add("Choose potassium-rich options like bananas and dried apricots");
                advice.add("Our naturally low-sodium products are perfect for you");
            }
            if (profile.has(HEART_DISEASE)) {
                advice.add("Prioritize high-fiber options for cardiovascular health");
                advice.add("Choose low-fat dried fruits and nuts");
            }
            if (profile.has(KIDNEY_DISEASE)) {
                advice.add("Select lower potassium options like apples and cranberries");
                advice.add("Moderate portions and consult your healthcare provider");
            }
            if (profile.has(FRUIT_ALLERGY) || profile.has(NUT_ALLERGY)) {
                advice.add("Always check labels for potential cross-contamination");
            }
        }
        if (advice.isEmpty()) {
            return "All SUNYA products are safe for your profile. Enjoy our premium selection!";
        }
        return String.join(". ", advice);
    }

    static List<String> alternatives(NutrientProfile n, UserProfile profile) {
        List<String> out = new ArrayList<>();
        if (profile != null) {
            if (profile.has(DIABETES) && n.carbs() > 70) {
                out.add("Lower carb dried fruits like berries");
                out.add("Nuts and seeds for balanced nutrition");
            }
            if (profile.has(KIDNEY_DISEASE) && n.potassium() > 500) {
                out.add("Lower potassium options like apples");
                out.add("Moderate portions of dried fruits");
            }
            if (profile.has(HEART_DISEASE) && n.fat() > 5) {
                out.add("Low-fat dried fruits");
                out.add("High-fiber options for heart health");
            }
        }
        if (out.isEmpty()) out.add("Consult with a nutritionist for personalized alternatives");
        return out;
    }

    private static FoodSafetyCheck result(String foodName, NutrientProfile n, UserProfile profile,
                                          SafetyLevel level, Set<String> reasons, String note) {
        boolean safe = level == SafetyLevel.SAFE;
        return new FoodSafetyCheck(foodName, safe, level, List.copyOf(reasons),
                safe ? List.of() : alternatives(n, profile), note);
    }
}
