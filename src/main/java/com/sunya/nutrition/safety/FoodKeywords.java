package com.sunya.nutrition.safety;

import java.util.List;
import java.util.Locale;

/**
 * Name-based heuristics for acidity and allergens. A substring hit on the food name is a
 * hint, not a verified ingredient fact.
 */
public final class FoodKeywords {

    private FoodKeywords() {}

    public static final List<String> ACIDIC_FOODS = List.of(
            "citrus", "lemon", "orange", "grapefruit", "lime",
            "tomato", "pineapple", "strawberry", "cranberry",
            "apple", "peach", "plum", "cherry");

    public static final List<String> NUTS = List.of(
            "almond", "cashew", "walnut", "pecan", "pistachio", "hazelnut", "macadamia", "brazil nut");

    public static final List<String> FRUITS = List.of(
            "fruit", "kiwi", "banana", "plantain", "mango", "berry", "berries", "pineapple", "ananas",
            "papaya", "pawpaw", "apple", "orange", "lemon", "lime", "grapefruit", "citrus", "grape",
            "raisin", "peach", "plum", "prune", "cherry", "apricot", "pear", "fig", "melon", "guava",
            "lychee", "passion fruit", "pomegranate", "coconut", "tomato");

    public static final double DEFAULT_ACIDIC_PH = 3.5;

    public static String lower(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }

    public static boolean containsAny(String name, List<String> keywords) {
        String n = lower(name);
        for (String k : keywords) {
            if (n.contains(k)) return true;
        }
        return false;
    }

    public static boolean isAcidic(String name) {
        return containsAny(name, ACIDIC_FOODS);
    }

    public static boolean isNut(String name) {
        return containsAny(name, NUTS);
    }

    public static boolean isFruit(String name) {
        return containsAny(name, FRUITS);
    }

    public static double estimatedPh(String name) {
        String n = lower(name);
        if (n.contains("tomato")) return 4.2;
        if (n.contains("strawberry") || n.contains("apple")) return 3.8;
        return DEFAULT_ACIDIC_PH;
    }
}
