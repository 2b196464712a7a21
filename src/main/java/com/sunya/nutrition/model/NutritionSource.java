package com.sunya.nutrition.model;

public enum NutritionSource {
    OPENFOODFACTS,
    USDA,
    /** Rows of the bundled nutrition table (catalog products, offline fallback). */
    LOCAL_TABLE,
    FALLBACK
}
