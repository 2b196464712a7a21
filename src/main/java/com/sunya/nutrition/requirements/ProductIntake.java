package com.sunya.nutrition.requirements;

public record ProductIntake(int grams, int servings, String reason) {}
