package com.sunya.nutrition.requirements;

import com.sunya.nutrition.profile.ActivityLevel;
import com.sunya.nutrition.profile.FitnessGoal;
import com.sunya.nutrition.profile.Gender;
import com.sunya.nutrition.profile.HealthSensitivity;
import com.sunya.nutrition.profile.UserProfile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BMR / TDEE / macro model (Mifflin-St Jeor). Stateless.
 */
public class DailyRequirementCalculator {

    public static final double DEFAULT_DAILY_CALORIES = 2000;

    public static final int MIN_AGE = 10, MAX_AGE = 100;
    public static final double MIN_HEIGHT_CM = 100, MAX_HEIGHT_CM = 250;
    public static final double MIN_WEIGHT_KG = 30, MAX_WEIGHT_KG = 200;

    static final int REFERENCE_AGE = 30;
    static final double REFERENCE_WEIGHT_KG = 70, REFERENCE_HEIGHT_CM = 170;

    static final int SERVING_GRAMS = 30;
    static final double PRODUCT_CALORIE_SHARE = 0.12;

    public record MacroSplit(double protein, double carbs, double fat) {}

    public DailyRequirements calculateDailyRequirements(UserProfile profile) {
        validate(profile);

        Gender gender = profile.genderOrDefault();
        FitnessGoal goal = profile.goalOrDefault();
        int age = profile.age();
        double weight = profile.weight();

        double tdee = bmr(gender, weight, profile.height(), age) * profile.activityLevel().multiplier();
        double calories = Math.round(tdee + goalAdjustment(goal));

        MacroSplit split = splitFor(goal);
        double protein = Math.round(calories * split.protein() / 4);
        double carbs = Math.round(calories * split.carbs() / 4);
        double fat = Math.round(calories * split.fat() / 9);
        double fiber = 25 + weight * 0.5;

        double vitaminC = (gender == Gender.MALE ? 90 : 75) + (age > 70 ? 10 : 0);
        double magnesium = (gender == Gender.MALE ? 400 : 310) + (age > 30 ? 10 : 0) + (age > 50 ? 10 : 0);
        double vitaminB6 = age > 50 ? 1.7 : 1.3;

        DailyRequirements base = new DailyRequirements(
                calories, protein, carbs, fiber, fat, vitaminC, 3500, magnesium, vitaminB6, 5000);
        return adjustForConditions(base, profile.healthSensitivities());
    }

    /**
     * Requirements for a possibly incomplete profile: missing body metrics and activity level
     * are taken from a reference adult (30 y, 70 kg, 170 cm, moderately active). Gender, goal
     * and health sensitivities are kept.
     */
    public DailyRequirements referenceRequirements(UserProfile profile) {
        if (profile == null) {
            profile = new UserProfile(null, null, null, null, null, null, List.of(), List.of());
        }
        UserProfile filled = new UserProfile(
                profile.age() == null ? REFERENCE_AGE : profile.age(),
                profile.weight() == null ? REFERENCE_WEIGHT_KG : profile.weight(),
                profile.height() == null ? REFERENCE_HEIGHT_CM : profile.height(),
                profile.gender(),
                profile.activityLevel() == null ? ActivityLevel.MODERATE : profile.activityLevel(),
                profile.fitnessGoal(),
                profile.healthSensitivities(),
                profile.customSensitivities());
        return calculateDailyRequirements(filled);
    }

    /**
     * Calorie baseline for the risk engine. Never throws: an incomplete profile yields
     * {@link #DEFAULT_DAILY_CALORIES}, a missing activity level counts as sedentary.
     */
    public double estimateDailyCalories(UserProfile profile) {
        if (profile == null || !profile.hasBodyMetrics()) return DEFAULT_DAILY_CALORIES;
        ActivityLevel level = profile.activityLevel() == null ? ActivityLevel.SEDENTARY : profile.activityLevel();
        double bmr = bmr(profile.genderOrDefault(), profile.weight(), profile.height(), profile.age());
        return Math.round(bmr * level.multiplier());
    }

    public static double bmr(Gender gender, double weightKg, double heightCm, int age) {
        double s = gender == Gender.FEMALE ? -161.0 : 5.0;
        return 10.0 * weightKg + 6.25 * heightCm - 5.0 * age + s;
    }

    public static double goalAdjustment(FitnessGoal goal) {
        return switch (goal) {
            case MUSCLE_GAIN -> 300;
            case WEIGHT_LOSS -> -500;
            case ENDURANCE -> 200;
            case GENERAL_WELLNESS -> 0;
        };
    }

    public static MacroSplit splitFor(FitnessGoal goal) {
        return switch (goal) {
            case MUSCLE_GAIN -> new MacroSplit(0.30, 0.45, 0.25);
            case WEIGHT_LOSS -> new MacroSplit(0.35, 0.35, 0.30);
            case ENDURANCE -> new MacroSplit(0.20, 0.60, 0.20);
            case GENERAL_WELLNESS -> new MacroSplit(0.25, 0.50, 0.25);
        };
    }

    public void validate(UserProfile profile) {
        List<FieldError> errors = new ArrayList<>();
        if (profile == null) {
            throw new ProfileValidationException(List.of(new FieldError("profile", "Profile is required")));
        }
        if (profile.age() == null || profile.age() < MIN_AGE || profile.age() > MAX_AGE) {
            errors.add(new FieldError("age", "Age must be between " + MIN_AGE + " and " + MAX_AGE));
        }
        if (profile.height() == null || profile.height() < MIN_HEIGHT_CM || profile.height() > MAX_HEIGHT_CM) {
            errors.add(new FieldError("height", "Height must be between 100 and 250 cm"));
        }
        if (profile.weight() == null || profile.weight() < MIN_WEIGHT_KG || profile.weight() > MAX_WEIGHT_KG) {
            errors.add(new FieldError("weight", "Weight must be between 30 and 200 kg"));
        }
        if (profile.activityLevel() == null) {
            errors.add(new FieldError("activityLevel", "Please select an activity level"));
        }
        if (!errors.isEmpty()) throw new ProfileValidationException(errors);
    }

    // Conditions compound in the order the profile lists them.
    static DailyRequirements adjustForConditions(DailyRequirements r, List<HealthSensitivity> sensitivities) {
        DailyRequirements out = r;
        for (HealthSensitivity s : sensitivities) {
            switch (s.restriction()) {
                case DIABETES -> out = out.withCarbs(Math.round(out.carbs() * 0.8))
                        .withFiber(Math.round(out.fiber() * 1.2));
                case HYPERTENSION -> out = out.withPotassium(Math.round(out.potassium() * 1.2));
                case HEART_DISEASE -> out = out.withFiber(Math.round(out.fiber() * 1.3))
                        .withFat(Math.round(out.fat() * 0.85));
                case KIDNEY_DISEASE -> out = out.withProtein(Math.round(out.protein() * 0.8))
                        .withPotassium(Math.round(out.potassium() * 0.7));
                default -> {
                }
            }
        }
        return out;
    }

    public List<NutrientStatus> calculateNutrientStatus(Map<String, Double> current, DailyRequirements required) {
        Map<String, Double> req = new LinkedHashMap<>();
        req.put("calories", required.calories());
        req.put("protein", required.protein());
        req.put("carbs", required.carbs());
        req.put("fiber", required.fiber());
        req.put("fat", required.fat());
        req.put("vitaminC", required.vitaminC());
        req.put("potassium", required.potassium());
        req.put("magnesium", required.magnesium());
        req.put("vitaminB6", required.vitaminB6());
        req.put("antioxidants", required.antioxidants());

        List<NutrientStatus> out = new ArrayList<>();
        for (Map.Entry<String, Double> e : req.entrySet()) {
            double cur = current == null ? 0 : current.getOrDefault(e.getKey(), 0.0);
            double need = e.getValue();
            long pct = need <= 0 ? 0 : Math.round(cur / need * 100);

            NutrientStatus.Level level;
            if (pct < 80) level = NutrientStatus.Level.DEFICIENT;
            else if (pct > 120) level = NutrientStatus.Level.EXCESS;
            else level = NutrientStatus.Level.ADEQUATE;

            out.add(new NutrientStatus(e.getKey(), cur, need, pct, level));
        }
        return out;
    }

    /** Daily portion of one product covering 12% of the calorie target, in 30 g servings. */
    public ProductIntake calculateProductIntake(DailyRequirements requirements,
                                                double productCalories,
                                                double productProtein,
                                                double productFiber) {
        double target = requirements.calories() * PRODUCT_CALORIE_SHARE;
        int grams = productCalories <= 0
                ? SERVING_GRAMS
                : (int) Math.round(target / productCalories * 100);
        int servings = (int) Math.round(grams / (double) SERVING_GRAMS);

        String reason = "Perfect for your daily nutrition";
        if (productProtein > 3) reason = "Great protein source for your goals";
        else if (productFiber > 10) reason = "High fiber for digestive health";
        else if (productCalories > 300) reason = "Energy-dense for your active lifestyle";

        return new ProductIntake(Math.max(SERVING_GRAMS, grams), Math.max(1, servings), reason);
    }
}
