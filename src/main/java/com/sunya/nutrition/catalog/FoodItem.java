package com.sunya.nutrition.catalog;

import java.util.List;
import java.util.Locale;

public record FoodItem(
        String id,
        String name,
        FoodType type,
        String description,
        NutrientProfile nutrition,
        List<String> benefits,
        GymFocus gymFocus
) {
    public FoodItem {
        benefits = benefits == null ? List.of() : List.copyOf(benefits);
        if (gymFocus == null) gymFocus = GymFocus.GENERAL;
    }

    /** "Kiwi (Dehydrated)" -> "kiwi" */
    public String baseName() {
        String n = name.toLowerCase(Locale.ROOT);
        int i = n.indexOf(" (");
        return (i > 0 ? n.substring(0, i) : n).trim();
    }
}
