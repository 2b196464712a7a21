package com.sunya.nutrition.safety;

import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.profile.DietaryRestriction;
import com.sunya.nutrition.profile.HealthSensitivity;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.requirements.DailyRequirementCalculator;
import com.sunya.nutrition.testsupport.TestRecords;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.sunya.nutrition.testsupport.TestRecords.food;
import static org.assertj.core.api.Assertions.assertThat;

class SafetyValidatorTest {

    private final SafetyValidator validator = new NutritionIntelligenceEngine(
            new DailyRequirementCalculator(), Clock.fixed(TestRecords.T0, ZoneOffset.UTC)).safetyValidator();

    private static final UserProfile DIABETIC = UserProfile.withRestrictions(DietaryRestriction.DIABETES);
    private static final NutritionRecord MANGO = food("Dried Mango", 319, 40);

    @Test
    void no_profile_is_never_blocked() {
        SafetyValidationResult r = validator.validateSafety(MANGO, null);

        assertThat(r.safe()).isTrue();
        assertThat(r.shouldBlock()).isFalse();
        assertThat(r.warnings()).isEmpty();
        assertThat(r.blockReason()).isNull();
        assertThat(validator.getSafeAlternatives(MANGO, null, List.of(food("Cucumber", 15, 1.7)))).isEmpty();
    }

    @Test
    void diabetic_is_blocked_from_high_sugar() {
        SafetyValidationResult r = validator.validateSafety(MANGO, DIABETIC);

        assertThat(r.shouldBlock()).isTrue();
        assertThat(r.safe()).isFalse();
        assertThat(r.blockReason()).isEqualTo("Contains high sugar");
        assertThat(r.warnings()).containsExactly(
                "This food contains 40.0g of sugar per 100g, which is 267% of the daily limit.",
                "High sugar content (40.0g per 100g) - may not be suitable for diabetes");
        assertThat(validator.isSafeForProfile(MANGO, DIABETIC)).isFalse();
        assertThat(validator.shouldBlockRecommendation(MANGO, DIABETIC)).isTrue();
    }

    @Test
    void high_risk_blocks_with_its_own_reason() {
        SafetyValidationResult r = validator.validateSafety(food("Oat bar", 150, 8),
                UserProfile.withRestrictions(DietaryRestriction.SUGAR_SENSITIVE));

        assertThat(r.shouldBlock()).isTrue();
        assertThat(r.blockReason()).isEqualTo("High in high sugar");
    }

    @Test
    void moderate_acidity_warns_without_blocking() {
        SafetyValidationResult r = validator.validateSafety(food("Dried Pineapple", 300, 8),
                UserProfile.withRestrictions(DietaryRestriction.ACID_REFLUX));

        assertThat(r.safe()).isTrue();
        assertThat(r.warnings()).containsExactly("Acidic food - may trigger acid reflux symptoms");
    }

    @Test
    void fruit_allergy_blocks_any_fruit_name() {
        SafetyValidationResult r = validator.validateSafety(food("Dried Banana", 340, 4),
                UserProfile.withRestrictions(DietaryRestriction.FRUIT_ALLERGY));

        assertThat(r.shouldBlock()).isTrue();
        assertThat(r.blockReason()).isEqualTo("Contains fruit allergen");
        assertThat(r.warnings()).contains("This is a fruit - you have a fruit allergy");
    }

    @Test
    void custom_sensitivity_matches_the_name() {
        UserProfile p = new UserProfile(null, null, null, null, null, null, List.of(), List.of(" MANGO "));

        SafetyValidationResult r = validator.validateSafety(food("Dried Mango", 319, 5), p);

        assertThat(r.shouldBlock()).isTrue();
        assertThat(r.blockReason()).isEqualTo("Matches custom sensitivities");
        assertThat(r.warnings()).containsExactly("Matches custom sensitivity:  MANGO ");
    }

    @Test
    void diet_style_restrictions_only_warn() {
        UserProfile p = new UserProfile(null, null, null, null, null, null,
                List.of(HealthSensitivity.of(DietaryRestriction.LOW_FIBER), HealthSensitivity.of(DietaryRestriction.HIGH_PROTEIN)),
                List.of());

        SafetyValidationResult r = validator.validateSafety(food("Prunes", 240, 2.2, 64, 7.1, 0.4, 4, null), p);

        assertThat(r.safe()).isTrue();
        assertThat(r.warnings()).containsExactly(
                "High fiber content (7.1g per 100g) - you follow a low fiber diet");
    }

    @Test
    void kidney_warning_uses_potassium_value() {
        NutritionRecord kiwi = food("Dried Kiwi", 250, 4.5, 58.8, 12, 2, 5, 1248.0);

        List<String> warnings = validator.getSafetyWarnings(kiwi, UserProfile.withRestrictions(DietaryRestriction.KIDNEY_DISEASE));

        assertThat(warnings).contains("High potassium content (1248mg per 100g) - may not be suitable for kidney disease");
    }

    @Test
    void every_blocked_result_has_reason_and_warning() {
        List<NutritionRecord> foods = List.of(MANGO, food("Oat bar", 150, 8), food("Dried Banana", 340, 4));
        List<UserProfile> profiles = List.of(DIABETIC,
                UserProfile.withRestrictions(DietaryRestriction.SUGAR_SENSITIVE),
                UserProfile.withRestrictions(DietaryRestriction.FRUIT_ALLERGY));

        for (NutritionRecord f : foods) {
            for (UserProfile p : profiles) {
                SafetyValidationResult r = validator.validateSafety(f, p);
                assertThat(r.safe()).isEqualTo(!r.shouldBlock());
                if (r.shouldBlock()) {
                    assertThat(r.blockReason()).isNotBlank();
                    assertThat(r.warnings()).isNotEmpty();
                }
            }
        }
    }

    @Test
    void report_uses_conservative_recommendation() {
        SafetyReport report = validator.getSafetyReport(food("Oat bar", 150, 8),
                UserProfile.withRestrictions(DietaryRestriction.SUGAR_SENSITIVE));

        assertThat(report.shouldBlock()).isTrue();
        assertThat(report.risks()).hasSize(1);
        assertThat(report.recommendation()).startsWith("Exercise caution with Oat bar.");
    }

    @Test
    void safe_alternatives_rank_safe_candidates_and_explain() {
        List<NutritionRecord> candidates = List.of(
                MANGO,
                food("Cucumber", 15, 1.7),
                food("Dried Pineapple", 300, 38),
                food("Rice cakes", 300, 1));

        List<SafeAlternative> alts = validator.getSafeAlternatives(MANGO, DIABETIC, candidates);

        assertThat(alts).extracting(a -> a.food().name()).containsExactly("Rice cakes", "Cucumber");
        assertThat(alts.get(1).reason()).isEqualTo("Does not contain high sugar");
        assertThat(alts.get(1).comparison()).isEqualTo("304 fewer calories per 100g, 38.3g less sugar per 100g");
    }

    @Test
    void at_most_three_alternatives() {
        List<NutritionRecord> candidates = List.of(
                food("Cucumber", 15, 1.7), food("Celery", 16, 1.3), food("Lettuce", 15, 0.8),
                food("Spinach", 23, 0.4), food("Zucchini", 17, 2.5));

        assertThat(validator.getSafeAlternatives(MANGO, DIABETIC, candidates)).hasSize(3);
    }

    @Test
    void similar_foods_compare_as_similar() {
        assertThat(SafetyValidator.comparison(food("A", 100, 10), food("B", 110, 11)))
                .isEqualTo("Similar nutritional profile");
    }
}
