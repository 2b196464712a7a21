package com.sunya.nutrition.requirements;

public record NutrientStatus(String nutrient, double current, double required, long percentage, Level status) {

    public enum Level { DEFICIENT, ADEQUATE, EXCESS }
}
