package com.sunya.nutrition.safety;

import com.sunya.nutrition.catalog.CatalogRepository;
import com.sunya.nutrition.catalog.NutrientProfile;
import com.sunya.nutrition.profile.DietaryRestriction;
import com.sunya.nutrition.profile.HealthSensitivity;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.testsupport.TestRecords;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FoodSafetyRulesTest {

    private final FoodSafetyRules rules = new FoodSafetyRules();
    private final CatalogRepository catalog = TestRecords.catalog();

    private NutrientProfile dried(String fruit) {
        return catalog.findDehydrated(fruit).orElseThrow().nutrition();
    }

    private static UserProfile profile(Integer age, DietaryRestriction... conditions) {
        return new UserProfile(age, null, null, null, null, null,
                Arrays.stream(conditions).map(HealthSensitivity::of).toList(), List.of());
    }

    @Test
    void no_profile_is_safe_without_restrictions() {
        FoodSafetyCheck c = rules.check("Dried Kiwi", dried("kiwi"), null);

        assertThat(c.safe()).isTrue();
        assertThat(c.level()).isEqualTo(SafetyLevel.SAFE);
        assertThat(c.reasons()).containsExactly("No specific health restrictions");
        assertThat(c.alternatives()).isEmpty();
        assertThat(c.note()).isEqualTo("Safe for your condition");
    }

    @Test
    void diabetes_flags_high_carb_food() {
        // banana: carbs 88.7 > 70, fiber 10.2 >= 8
        FoodSafetyCheck c = rules.check("Dried Banana", dried("banana"), profile(null, DietaryRestriction.DIABETES));

        assertThat(c.level()).isEqualTo(SafetyLevel.CAUTION);
        assertThat(c.safe()).isFalse();
        assertThat(c.reasons()).containsExactly(
                "High carbohydrate content may affect blood sugar levels",
                "High fiber helps regulate blood sugar");
        assertThat(c.note()).isEqualTo("Limit due to high carbs - monitor blood sugar");
        assertThat(c.alternatives()).containsExactly(
                "Lower carb dried fruits like berries", "Nuts and seeds for balanced nutrition");
    }

    @Test
    void heart_disease_passes_low_fat_high_fiber_food() {
        FoodSafetyCheck c = rules.check("Dried Kiwi", dried("kiwi"), profile(null, DietaryRestriction.HEART_DISEASE));

        assertThat(c.level()).isEqualTo(SafetyLevel.SAFE);
        assertThat(c.reasons()).containsExactly(
                "High fiber supports cardiovascular health", "Low fat content is heart-healthy");
        assertThat(c.note()).isEqualTo("Safe for your condition - low fat content");
    }

    @Test
    void kidney_disease_limits_potassium() {
        // kiwi: potassium 1248 > 500, protein 4.5 <= 5
        FoodSafetyCheck kiwi = rules.check("Dried Kiwi", dried("kiwi"), profile(null, DietaryRestriction.KIDNEY_DISEASE));
        assertThat(kiwi.level()).isEqualTo(SafetyLevel.CAUTION);
        assertThat(kiwi.reasons()).containsExactly(
                "High potassium may burden the kidneys", "Moderate protein level suitable for kidney health");
        assertThat(kiwi.note()).isEqualTo("Limit due to high potassium");
        assertThat(kiwi.alternatives()).containsExactly(
                "Lower potassium options like apples", "Moderate portions of dried fruits");

        // apple: potassium 500 sits on the limit, protein 1.4
        FoodSafetyCheck apple = rules.check("Dried Apple", dried("apple"), profile(null, DietaryRestriction.KIDNEY_DISEASE));
        assertThat(apple.level()).isEqualTo(SafetyLevel.SAFE);
    }

    @Test
    void age_groups_use_their_own_thresholds() {
        NutrientProfile apple = dried("apple");   // 243 kcal, vitamin C 21, protein 1.4
        NutrientProfile kiwi = dried("kiwi");     // 250 kcal, vitamin C 370, protein 4.5
        NutrientProfile papaya = dried("papaya"); // antioxidants 1680

        assertThat(rules.check("a", apple, profile(8)).level()).isEqualTo(SafetyLevel.CAUTION);
        assertThat(rules.check("k", kiwi, profile(8)).level()).isEqualTo(SafetyLevel.SAFE);
        assertThat(rules.check("a", apple, profile(15)).level()).isEqualTo(SafetyLevel.CAUTION);
        assertThat(rules.check("k", kiwi, profile(15)).level()).isEqualTo(SafetyLevel.SAFE);
        assertThat(rules.check("p", papaya, profile(30)).level()).isEqualTo(SafetyLevel.CAUTION);
        assertThat(rules.check("k", kiwi, profile(65)).level()).isEqualTo(SafetyLevel.SAFE);
        assertThat(rules.check("p", papaya, profile(65)).level()).isEqualTo(SafetyLevel.CAUTION);
    }

    @Test
    void age_caution_is_not_hidden_by_passing_condition_rules() {
        FoodSafetyCheck c = rules.check("Dried Papaya", dried("papaya"), profile(30, DietaryRestriction.HYPERTENSION));

        assertThat(c.level()).isEqualTo(SafetyLevel.CAUTION);
        assertThat(c.reasons()).first().isEqualTo("May not be optimal for your age group");
        assertThat(c.reasons()).contains("High potassium helps lower blood pressure", "Naturally low in sodium");
        assertThat(c.note()).isEqualTo("Use with caution - consider alternatives");
        assertThat(c.alternatives()).containsExactly("Consult with a nutritionist for personalized alternatives");
    }

    @Test
    void shared_reasons_are_listed_once() {
        FoodSafetyCheck c = rules.check("Dried Kiwi", dried("kiwi"),
                profile(null, DietaryRestriction.NUT_ALLERGY, DietaryRestriction.GLUTEN_INTOLERANCE));

        assertThat(c.reasons()).containsExactly("Naturally free of common allergens");
        assertThat(c.level()).isEqualTo(SafetyLevel.SAFE);
    }

    @Test
    void summary_counts_levels() {
        NutrientProfile kiwi = dried("kiwi");
        List<FoodSafetyCheck> checks = List.of(
                rules.check("a", kiwi, null),
                rules.check("b", kiwi, null),
                rules.check("c", dried("papaya"), profile(30)),
                rules.avoid("d", kiwi, null, List.of("blocked")));

        SafetySummary s = rules.summarize(checks);

        assertThat(s).isEqualTo(new SafetySummary(2, 1, 1, 4, 50));
        assertThat(rules.summarize(List.of()).percentage()).isZero();
    }

    @Test
    void avoid_verdict_keeps_the_given_reasons() {
        FoodSafetyCheck c = rules.avoid("Dried Banana", dried("banana"), profile(null, DietaryRestriction.DIABETES),
                List.of("High Sugar"));

        assertThat(c.level()).isEqualTo(SafetyLevel.AVOID);
        assertThat(c.reasons()).containsExactly("High Sugar");
        assertThat(c.note()).isEqualTo("Avoid due to health condition");
        assertThat(c.alternatives()).startsWith("Lower carb dried fruits like berries");
    }

    @Test
    void advice_follows_conditions() {
        assertThat(rules.advice(null)).startsWith("All SUNYA products are safe");
        assertThat(rules.advice(profile(40))).startsWith("All SUNYA products are safe");
        assertThat(rules.advice(profile(null, DietaryRestriction.DIABETES, DietaryRestriction.KIDNEY_DISEASE)))
                .isEqualTo("Focus on high-fiber, lower-carb options like berries and apples. "
                        + "Monitor portion sizes and pair with protein. "
                        + "Select lower potassium options like apples and cranberries. "
                        + "Moderate portions and consult your healthcare provider");
    }
}
