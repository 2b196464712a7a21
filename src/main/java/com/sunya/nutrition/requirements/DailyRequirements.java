package com.sunya.nutrition.requirements;

/**
 * Daily targets. Energy in kcal; protein, carbs, fiber and fat in g; vitamin C, potassium,
 * magnesium and vitamin B6 in mg; antioxidants in ORAC units.
 */
public record DailyRequirements(
        double calories,
        double protein,
        double carbs,
        double fiber,
        double fat,
        double vitaminC,
        double potassium,
        double magnesium,
        double vitaminB6,
        double antioxidants
) {
    DailyRequirements withCarbs(double v) {
        return new DailyRequirements(calories, protein, v, fiber, fat, vitaminC, potassium, magnesium, vitaminB6, antioxidants);
    }

    DailyRequirements withFiber(double v) {
        return new DailyRequirements(calories, protein, carbs, v, fat, vitaminC, potassium, magnesium, vitaminB6, antioxidants);
    }

    DailyRequirements withFat(double v) {
        return new DailyRequirements(calories, protein, carbs, fiber, v, vitaminC, potassium, magnesium, vitaminB6, antioxidants);
    }

    DailyRequirements withProtein(double v) {
        return new DailyRequirements(calories, v, carbs, fiber, fat, vitaminC, potassium, magnesium, vitaminB6, antioxidants);
    }

    DailyRequirements withPotassium(double v) {
        return new DailyRequirements(calories, protein, carbs, fiber, fat, vitaminC, v, magnesium, vitaminB6, antioxidants);
    }
}
