package com.sunya.nutrition.requirements;

import com.sunya.nutrition.profile.ActivityLevel;
import com.sunya.nutrition.profile.DietaryRestriction;
import com.sunya.nutrition.profile.FitnessGoal;
import com.sunya.nutrition.profile.Gender;
import com.sunya.nutrition.profile.HealthSensitivity;
import com.sunya.nutrition.profile.UserProfile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DailyRequirementCalculatorTest {

    private final DailyRequirementCalculator calc = new DailyRequirementCalculator();

    private static UserProfile adult(ActivityLevel level, FitnessGoal goal, DietaryRestriction... conditions) {
        return new UserProfile(30, 70.0, 170.0, Gender.MALE, level, goal,
                List.of(conditions).stream().map(HealthSensitivity::of).toList(), List.of());
    }

    @Test
    void reference_male_moderate_wellness() {
        DailyRequirements r = calc.calculateDailyRequirements(adult(ActivityLevel.MODERATE, FitnessGoal.GENERAL_WELLNESS));

        // BMR 1617.5 * 1.55
        assertThat(r.calories()).isEqualTo(2507);
        assertThat(r.protein()).isEqualTo(157);
        assertThat(r.carbs()).isEqualTo(313);
        assertThat(r.fat()).isEqualTo(70);
        assertThat(r.fiber()).isEqualTo(60);
        assertThat(r.vitaminC()).isEqualTo(90);
        assertThat(r.potassium()).isEqualTo(3500);
        assertThat(r.magnesium()).isEqualTo(400);
        assertThat(r.vitaminB6()).isEqualTo(1.3);
        assertThat(r.antioxidants()).isEqualTo(5000);
    }

    @Test
    void older_woman_losing_weight() {
        UserProfile p = new UserProfile(55, 60.0, 160.0, Gender.FEMALE, ActivityLevel.SEDENTARY,
                FitnessGoal.WEIGHT_LOSS, List.of(), List.of());

        DailyRequirements r = calc.calculateDailyRequirements(p);

        assertThat(r.calories()).isEqualTo(897);
        assertThat(r.vitaminC()).isEqualTo(75);
        assertThat(r.magnesium()).isEqualTo(330);
        assertThat(r.vitaminB6()).isEqualTo(1.7);
    }

    @Test
    void diabetes_lowers_carbs_and_raises_fiber() {
        DailyRequirements r = calc.calculateDailyRequirements(
                adult(ActivityLevel.MODERATE, FitnessGoal.GENERAL_WELLNESS, DietaryRestriction.DIABETES));

        assertThat(r.carbs()).isEqualTo(250);
        assertThat(r.fiber()).isEqualTo(72);
    }

    @Test
    void kidney_disease_lowers_protein_and_potassium() {
        DailyRequirements r = calc.calculateDailyRequirements(
                adult(ActivityLevel.MODERATE, FitnessGoal.GENERAL_WELLNESS, DietaryRestriction.KIDNEY_DISEASE));

        assertThat(r.protein()).isEqualTo(126);
        assertThat(r.potassium()).isEqualTo(2450);
    }

    @Test
    void invalid_profile_reports_every_field() {
        UserProfile p = new UserProfile(5, 250.0, null, null, null, null, List.of(), List.of());

        assertThatThrownBy(() -> calc.calculateDailyRequirements(p))
                .isInstanceOfSatisfying(ProfileValidationException.class, e ->
                        assertThat(e.getErrors()).extracting(FieldError::field)
                                .containsExactly("age", "height", "weight", "activityLevel"));
    }

    @Test
    void missing_profile_is_rejected() {
        assertThatThrownBy(() -> calc.calculateDailyRequirements(null))
                .isInstanceOf(ProfileValidationException.class);
    }

    @Test
    void reference_requirements_fill_missing_metrics() {
        DailyRequirements r = calc.referenceRequirements(UserProfile.withRestrictions(DietaryRestriction.DIABETES));

        assertThat(r.calories()).isEqualTo(2507);
        assertThat(r.carbs()).isEqualTo(250);
        assertThat(calc.referenceRequirements(null).calories()).isEqualTo(2507);
    }

    @Test
    void daily_calorie_estimate_never_throws() {
        assertThat(calc.estimateDailyCalories(null)).isEqualTo(2000);
        assertThat(calc.estimateDailyCalories(UserProfile.withRestrictions())).isEqualTo(2000);

        UserProfile noActivity = new UserProfile(30, 70.0, 170.0, Gender.MALE, null, null, List.of(), List.of());
        assertThat(calc.estimateDailyCalories(noActivity)).isEqualTo(1941);
    }

    @Test
    void nutrient_status_classifies_against_80_and_120_percent() {
        DailyRequirements r = calc.calculateDailyRequirements(adult(ActivityLevel.MODERATE, FitnessGoal.GENERAL_WELLNESS));

        List<NutrientStatus> status = calc.calculateNutrientStatus(Map.of("calories", 2507.0, "fiber", 80.0), r);

        assertThat(status).hasSize(10);
        assertThat(status.get(0).status()).isEqualTo(NutrientStatus.Level.ADEQUATE);
        assertThat(status.get(0).percentage()).isEqualTo(100);
        assertThat(status).filteredOn(s -> s.nutrient().equals("fiber"))
                .singleElement()
                .extracting(NutrientStatus::status)
                .isEqualTo(NutrientStatus.Level.EXCESS);
        assertThat(status).filteredOn(s -> s.nutrient().equals("protein"))
                .singleElement()
                .extracting(NutrientStatus::status)
                .isEqualTo(NutrientStatus.Level.DEFICIENT);
    }

    @Test
    void product_intake_covers_twelve_percent_of_calories() {
        DailyRequirements r = calc.calculateDailyRequirements(adult(ActivityLevel.MODERATE, FitnessGoal.GENERAL_WELLNESS));

        ProductIntake kiwi = calc.calculateProductIntake(r, 250, 4.5, 12);
        assertThat(kiwi.grams()).isEqualTo(120);
        assertThat(kiwi.servings()).isEqualTo(4);
        assertThat(kiwi.reason()).isEqualTo("Great protein source for your goals");

        ProductIntake unknown = calc.calculateProductIntake(r, 0, 0, 0);
        assertThat(unknown.grams()).isEqualTo(30);
        assertThat(unknown.servings()).isEqualTo(1);
        assertThat(unknown.reason()).isEqualTo("Perfect for your daily nutrition");
    }
}
